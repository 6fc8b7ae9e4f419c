package pal.xafs.ui.liveviewer;

import javafx.application.Platform;

import java.util.concurrent.Executor;

/**
 * Runs canvas updates on the JavaFX application thread.
 */
public class FxRenderContext implements Executor {

    @Override
    public void execute(Runnable command) {
        if (Platform.isFxApplicationThread()) {
            command.run();
        } else {
            Platform.runLater(command);
        }
    }
}
