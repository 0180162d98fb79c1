package org.example.coach.service;

import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

@Service
public class ConversationMetricsService {

    private final LongAdder eventsHandled = new LongAdder();
    private final LongAdder invalidSelections = new LongAdder();
    private final LongAdder storeFailures = new LongAdder();
    private final LongAdder internalFailures = new LongAdder();
    private final LongAdder quizzesCompleted = new LongAdder();
    private final LongAdder quizzesPassed = new LongAdder();
    private final LongAdder scenariosConcluded = new LongAdder();
    private final LongAdder scenarioFallbacks = new LongAdder();
    private final LongAdder rewardsGranted = new LongAdder();
    private final LongAdder referralsCompleted = new LongAdder();
    private final LongAdder gatewayFailures = new LongAdder();
    private final AtomicLong handlingLatencyTotalMs = new AtomicLong(0);

    public void recordEventHandled(long durationMs) {
        eventsHandled.increment();
        if (durationMs > 0) {
            handlingLatencyTotalMs.addAndGet(durationMs);
        }
    }

    public void recordInvalidSelection() {
        invalidSelections.increment();
    }

    public void recordStoreFailure() {
        storeFailures.increment();
    }

    public void recordInternalFailure() {
        internalFailures.increment();
    }

    public void recordQuizCompleted(boolean passed) {
        quizzesCompleted.increment();
        if (passed) {
            quizzesPassed.increment();
        }
    }

    public void recordScenarioConcluded(boolean fallback) {
        scenariosConcluded.increment();
        if (fallback) {
            scenarioFallbacks.increment();
        }
    }

    public void recordRewardGranted() {
        rewardsGranted.increment();
    }

    public void recordReferralCompleted() {
        referralsCompleted.increment();
    }

    public void recordGatewayFailure() {
        gatewayFailures.increment();
    }

    public Map<String, Object> snapshot() {
        long handled = eventsHandled.sum();
        long avgLatencyMs = handled == 0 ? 0 : handlingLatencyTotalMs.get() / handled;

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("eventsHandled", handled);
        metrics.put("eventAverageLatencyMs", avgLatencyMs);
        metrics.put("invalidSelections", invalidSelections.sum());
        metrics.put("storeFailures", storeFailures.sum());
        metrics.put("internalFailures", internalFailures.sum());
        metrics.put("quizzesCompleted", quizzesCompleted.sum());
        metrics.put("quizzesPassed", quizzesPassed.sum());
        metrics.put("scenariosConcluded", scenariosConcluded.sum());
        metrics.put("scenarioFallbacks", scenarioFallbacks.sum());
        metrics.put("rewardsGranted", rewardsGranted.sum());
        metrics.put("referralsCompleted", referralsCompleted.sum());
        metrics.put("gatewayFailures", gatewayFailures.sum());
        return metrics;
    }
}
