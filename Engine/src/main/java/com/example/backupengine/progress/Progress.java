package com.example.backupengine.progress;

import java.util.Objects;

/**
 * Eventos de progresso emitidos por backup e restauração.
 */
public final class Progress {

    private Progress() {}

    public enum Step {
        COLLECTING_STATE("collecting_state"),
        EXPORTING_DB("exporting_db"),
        COLLECTING_FILES("collecting_files"),
        ZIPPING("zipping"),
        RESTORING_DB("restoring_db"),
        RESTORING_PREFS("restoring_prefs"),
        RESTORING_FILES("restoring_files"),
        FINALIZING("finalizing"),
        DONE("done"),
        FAILED("failed");

        private final String wireName;

        Step(String wireName) { this.wireName = wireName; }

        public String wireName() { return wireName; }
    }

    public static final class ProgressEvent {
        private final Step step;
        private final String message;
        private final int current;
        private final int total;

        public ProgressEvent(Step step, String message, int current, int total) {
            this.step = Objects.requireNonNull(step, "step");
            this.message = message == null ? "" : message;
            this.current = current;
            this.total = total;
        }

        public static ProgressEvent of(Step step, String message) {
            return new ProgressEvent(step, message, 0, 0);
        }

        public Step step() { return step; }
        public String message() { return message; }
        public int current() { return current; }
        /** 0 quando o total não é conhecido. */
        public int total() { return total; }

        @Override
        public String toString() {
            return total > 0
                    ? step.wireName() + " " + current + "/" + total + " " + message
                    : step.wireName() + " " + message;
        }
    }

    @FunctionalInterface
    public interface ProgressListener {
        ProgressListener NONE = event -> { };

        void onProgress(ProgressEvent event);
    }
}
