package assess;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.swing.SwingUtilities;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

class SwingProgressTest {

    private static void flushEventQueue() throws InterruptedException, InvocationTargetException {
        SwingUtilities.invokeAndWait(() -> { });
    }

    @Test
    @DisplayName("updates and the cancel check run on the event thread while the worker reads a flag")
    void update_checksCancelOnEventThread() throws Exception {
        // given
        List<String> shown = new ArrayList<>();
        List<Boolean> onEventThread = new ArrayList<>();
        AtomicBoolean userCancelled = new AtomicBoolean();
        SwingProgress progress = new SwingProgress((percent, label) -> {
            onEventThread.add(SwingUtilities.isEventDispatchThread());
            shown.add(percent + " " + label);
        }, () -> {
            onEventThread.add(SwingUtilities.isEventDispatchThread());
            return userCancelled.get();
        });

        // when
        progress.update(10, "Fetching students...");
        flushEventQueue();

        // then
        assertThat(shown).containsExactly("10 Fetching students...");
        assertThat(progress.isCancelled()).isFalse();

        // when
        userCancelled.set(true);
        progress.update(20, "Fetching submissions...");
        flushEventQueue();

        // then
        assertThat(progress.isCancelled()).isTrue();
        assertThat(shown).hasSize(2);
        assertThat(onEventThread).isNotEmpty().containsOnly(true);
    }
}
