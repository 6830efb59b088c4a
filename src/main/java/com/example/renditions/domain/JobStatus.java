package com.example.renditions.domain;

/**
 * Lifecycle state of a transcode job as a closed set of variants.
 * Each variant carries only the data that is meaningful in that state.
 */
public sealed interface JobStatus
        permits JobStatus.Pending, JobStatus.Processing, JobStatus.Completed, JobStatus.Failed {

    String name();

    int progress();

    default boolean isTerminal() {
        return this instanceof Completed || this instanceof Failed;
    }

    record Pending() implements JobStatus {
        @Override
        public String name() {
            return "pending";
        }

        @Override
        public int progress() {
            return 0;
        }
    }

    record Processing(int progress) implements JobStatus {
        @Override
        public String name() {
            return "processing";
        }
    }

    record Completed(String outputPath) implements JobStatus {
        @Override
        public String name() {
            return "completed";
        }

        @Override
        public int progress() {
            return 100;
        }
    }

    record Failed(FailureReason reason, String errorMessage) implements JobStatus {
        @Override
        public String name() {
            return "failed";
        }

        @Override
        public int progress() {
            return 0;
        }
    }
}
