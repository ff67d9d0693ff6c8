package assess;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.swing.SwingUtilities;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UiKitTest {

    @Test
    @DisplayName("dialogs asked from a worker thread run on the event thread and return their answer")
    void onEventThread_fromWorker() {
        // when
        String answer = UiKit.onEventThread(() ->
                SwingUtilities.isEventDispatchThread() ? "https://fit.instructure.com" : "wrong thread");

        // then
        assertThat(answer).isEqualTo("https://fit.instructure.com");
    }

    @Test
    @DisplayName("on the event thread the dialog runs in place")
    void onEventThread_alreadyThere() throws Exception {
        // given
        AtomicReference<Boolean> answer = new AtomicReference<>();

        // when
        SwingUtilities.invokeAndWait(() -> answer.set(UiKit.onEventThread(() -> Boolean.TRUE)));

        // then
        assertThat(answer.get()).isTrue();
    }

    @Test
    @DisplayName("a failing dialog rethrows its runtime exception on the calling thread")
    void onEventThread_rethrows() {
        assertThatThrownBy(() -> UiKit.onEventThread(() -> {
            throw new IllegalStateException("no owner frame");
        })).isInstanceOf(IllegalStateException.class).hasMessage("no owner frame");
    }
}
