package com.umitunal.corequeue.worker;

import com.umitunal.corequeue.core.Job;

/**
 * Interface for processing jobs leased from the queue.
 *
 * @param <T> the type of job payload
 */
@FunctionalInterface
public interface JobProcessor<T> {

    /**
     * Process a job and return the outcome.
     *
     * @param job the leased job
     * @return processing outcome
     * @throws Exception if processing fails; treated like a failure outcome
     */
    ProcessingResult process(Job<T> job) throws Exception;

    /**
     * Outcome of job processing.
     */
    class ProcessingResult {
        private final Outcome outcome;
        private final String message;
        private final byte[] result;

        private ProcessingResult(Outcome outcome, String message, byte[] result) {
            this.outcome = outcome;
            this.message = message;
            this.result = result;
        }

        public Outcome getOutcome() { return outcome; }
        public String getMessage() { return message; }
        /** Result to store before completing, or null. */
        public byte[] getResult() { return result; }

        public static ProcessingResult success() {
            return new ProcessingResult(Outcome.SUCCESS, null, null);
        }

        public static ProcessingResult success(byte[] result) {
            return new ProcessingResult(Outcome.SUCCESS, null, result);
        }

        public static ProcessingResult failure(String message) {
            return new ProcessingResult(Outcome.FAILURE, message, null);
        }

        public static ProcessingResult defer(String message) {
            return new ProcessingResult(Outcome.DEFERRED, message, null);
        }
    }

    enum Outcome {
        SUCCESS,
        FAILURE,
        DEFERRED
    }
}
