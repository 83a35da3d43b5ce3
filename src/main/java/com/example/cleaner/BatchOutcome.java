package com.example.cleaner;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of processing one batch: either {@link Success} with partition sizes, or
 * {@link Failed} with the reason the batch was dropped.
 */
@Getter
@ToString
@EqualsAndHashCode
public abstract class BatchOutcome {

    private final int batchIndex;

    private BatchOutcome(int batchIndex) {
        this.batchIndex = batchIndex;
    }

    public abstract boolean isSuccess();

    public static Success success(int batchIndex, long validCount, long garbageCount) {
        return new Success(batchIndex, validCount, garbageCount);
    }

    public static Failed failed(int batchIndex, String reason) {
        return new Failed(batchIndex, reason);
    }

    @Getter
    @ToString(callSuper = true)
    @EqualsAndHashCode(callSuper = true)
    public static final class Success extends BatchOutcome {
        private final long validCount;
        private final long garbageCount;

        private Success(int batchIndex, long validCount, long garbageCount) {
            super(batchIndex);
            this.validCount = validCount;
            this.garbageCount = garbageCount;
        }

        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    @Getter
    @ToString(callSuper = true)
    @EqualsAndHashCode(callSuper = true)
    public static final class Failed extends BatchOutcome {
        private final String reason;

        private Failed(int batchIndex, String reason) {
            super(batchIndex);
            this.reason = reason;
        }

        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
