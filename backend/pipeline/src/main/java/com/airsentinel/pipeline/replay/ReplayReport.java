package com.airsentinel.pipeline.replay;

public record ReplayReport(String origin, int ingested, int malformed, int rejected) {
    public int total() {
        return ingested + malformed + rejected;
    }
}
