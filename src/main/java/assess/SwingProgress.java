package assess;

import javax.swing.SwingUtilities;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiConsumer;
import java.util.function.BooleanSupplier;

/**
 * Report progress from a worker thread shown in Swing. The display and the
 * cancel check both run on the event thread; the worker only reads a flag.
 */
class SwingProgress implements ReportProgress {

    private final BiConsumer<Integer, String> display;
    private final BooleanSupplier cancelRequested;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    /**
     * @param display         shows percent and label, called on the event thread
     * @param cancelRequested asks the UI whether the user cancelled, called on the event thread
     */
    SwingProgress(BiConsumer<Integer, String> display, BooleanSupplier cancelRequested) {
        this.display = display;
        this.cancelRequested = cancelRequested;
    }

    @Override
    public void update(int percent, String label) {
        SwingUtilities.invokeLater(() -> {
            if (cancelRequested.getAsBoolean()) cancelled.set(true);
            display.accept(percent, label);
        });
    }

    @Override
    public boolean isCancelled() {
        return cancelled.get();
    }
}
