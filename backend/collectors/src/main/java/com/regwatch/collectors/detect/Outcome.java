package com.regwatch.collectors.detect;

import com.regwatch.core.model.Change;

public interface Outcome {
    String label();

    record FirstSeen() implements Outcome {
        @Override
        public String label() {
            return "first-seen";
        }
    }

    record Unchanged() implements Outcome {
        @Override
        public String label() {
            return "unchanged";
        }
    }

    record Changed(Change change) implements Outcome {
        @Override
        public String label() {
            return "changed";
        }
    }
}
