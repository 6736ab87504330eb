/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.taskflow.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable value object describing how a single workflow step finished.
 *
 * <p>SUCCESS and FAILED outcomes are produced by the worker, SKIPPED outcomes by the workflow
 * engine when an upstream step failed. Exactly one of result, error message or skip reason is
 * meaningful for a given status:</p>
 * <ul>
 *   <li>{@link StepStatus#SUCCESS}: {@link #getResult()} holds the opaque payload returned by the
 *       step (which may itself be {@code null})</li>
 *   <li>{@link StepStatus#FAILED}: {@link #getErrorMessage()} holds the normalized message and
 *       {@link #getCause()} the exception or error that escaped the decorator chain</li>
 *   <li>{@link StepStatus#SKIPPED}: {@link #getSkipReason()} names the failed ancestor</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class StepOutcome {

    private final StepStatus status;
    private final Object result;
    private final String errorMessage;
    private final String skipReason;
    private final Throwable cause;
    private final Instant startedAt;
    private final Instant finishedAt;

    private StepOutcome(StepStatus status, Object result, String errorMessage, String skipReason,
                        Throwable cause, Instant startedAt, Instant finishedAt) {
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.startedAt = Objects.requireNonNull(startedAt, "Start time cannot be null");
        this.finishedAt = Objects.requireNonNull(finishedAt, "Finish time cannot be null");
        this.result = result;
        this.errorMessage = errorMessage;
        this.skipReason = skipReason;
        this.cause = cause;
    }

    public static StepOutcome success(Object result, Instant startedAt, Instant finishedAt) {
        return new StepOutcome(StepStatus.SUCCESS, result, null, null, null, startedAt, finishedAt);
    }

    public static StepOutcome failed(String errorMessage, Throwable cause, Instant startedAt, Instant finishedAt) {
        Objects.requireNonNull(errorMessage, "Error message cannot be null");
        return new StepOutcome(StepStatus.FAILED, null, errorMessage, null, cause, startedAt, finishedAt);
    }

    public static StepOutcome skipped(String reason, Instant skippedAt) {
        Objects.requireNonNull(reason, "Skip reason cannot be null");
        return new StepOutcome(StepStatus.SKIPPED, null, null, reason, null, skippedAt, skippedAt);
    }

    public StepStatus getStatus() {
        return status;
    }

    public Object getResult() {
        return result;
    }

    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    public Optional<String> getSkipReason() {
        return Optional.ofNullable(skipReason);
    }

    public Optional<Throwable> getCause() {
        return Optional.ofNullable(cause);
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public Duration getDuration() {
        return Duration.between(startedAt, finishedAt);
    }

    public boolean isSuccessful() {
        return status == StepStatus.SUCCESS;
    }

    public boolean isFailed() {
        return status == StepStatus.FAILED;
    }

    public boolean isSkipped() {
        return status == StepStatus.SKIPPED;
    }

    /**
     * Returns the payload that is persisted for this outcome: the result for successful steps,
     * the error message for failed ones and the skip reason for skipped ones.
     */
    public Object getPayload() {
        switch (status) {
            case FAILED:
                return errorMessage;
            case SKIPPED:
                return skipReason;
            default:
                return result;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StepOutcome that = (StepOutcome) o;
        return status == that.status &&
               Objects.equals(result, that.result) &&
               Objects.equals(errorMessage, that.errorMessage) &&
               Objects.equals(skipReason, that.skipReason) &&
               Objects.equals(startedAt, that.startedAt) &&
               Objects.equals(finishedAt, that.finishedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, result, errorMessage, skipReason, startedAt, finishedAt);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("StepOutcome{status=").append(status);
        if (errorMessage != null) {
            sb.append(", error='").append(errorMessage).append('\'');
        }
        if (skipReason != null) {
            sb.append(", reason='").append(skipReason).append('\'');
        }
        sb.append(", duration=").append(getDuration().toMillis()).append("ms}");
        return sb.toString();
    }
}
