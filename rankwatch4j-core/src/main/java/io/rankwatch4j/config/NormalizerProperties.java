package io.rankwatch4j.config;

import io.rankwatch4j.normalize.MalformedItemPolicy;

public class NormalizerProperties {
    private MalformedItemPolicy malformedItemPolicy = MalformedItemPolicy.FAIL_BATCH;

    public MalformedItemPolicy getMalformedItemPolicy() {
        return malformedItemPolicy;
    }

    public void setMalformedItemPolicy(MalformedItemPolicy malformedItemPolicy) {
        this.malformedItemPolicy = malformedItemPolicy;
    }
}
