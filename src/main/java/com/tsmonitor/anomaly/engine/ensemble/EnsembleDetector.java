package com.tsmonitor.anomaly.engine.ensemble;

import com.tsmonitor.anomaly.engine.AbstractDetector;
import com.tsmonitor.anomaly.engine.Detector;
import com.tsmonitor.anomaly.engine.isolationforest.IsolationForestDetector;
import com.tsmonitor.anomaly.engine.lof.LofDetector;
import com.tsmonitor.anomaly.engine.statistical.StatisticalDetector;
import com.tsmonitor.anomaly.engine.statistical.StatisticalMethod;
import com.tsmonitor.anomaly.exception.AnomalyDetectionException;
import com.tsmonitor.anomaly.exception.InvalidConfigurationException;
import com.tsmonitor.anomaly.exception.NoVerdictException;
import com.tsmonitor.anomaly.model.DetectionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Combines several detectors into one verdict.
 *
 * Majority voting scores each point with the fraction of members that flag it.
 * Weighted voting min-max normalizes each member's score vector to [0, 1] and sums them
 * with the member weights. A member that fails to fit is left out for good; a member that
 * fails during a call is left out of that call only. When no member contributes to a call,
 * a {@link NoVerdictException} is raised instead of reporting every point as normal.
 */
public class EnsembleDetector extends AbstractDetector {

    private static final Logger log = LoggerFactory.getLogger(EnsembleDetector.class);

    public static final double DEFAULT_MEMBER_THRESHOLD = 3.0;

    /**
     * Notified whenever a member is dropped from a fit or a scoring call.
     */
    @FunctionalInterface
    public interface MemberFailureListener {
        void onFailure(Detector member, String phase, RuntimeException error);
    }

    private final List<Detector> members;
    private final EnsembleConfig config;
    private volatile List<Integer> survivors = Collections.emptyList();
    private volatile MemberFailureListener failureListener = (member, phase, error) -> { };

    public EnsembleDetector(List<? extends Detector> members, EnsembleConfig config) {
        super("EnsembleDetector", config.getVotingMode().getDefaultThreshold());
        if (members.size() != config.getWeights().size()) {
            throw new InvalidConfigurationException(String.format(
                    "Ensemble has %d members but %d weights", members.size(), config.getWeights().size()));
        }
        this.members = List.copyOf(members);
        this.config = config;
    }

    public EnsembleDetector(VotingMode votingMode, List<Double> weights) {
        this(defaultMembers(DEFAULT_MEMBER_THRESHOLD, IsolationForestDetector.DEFAULT_CONTAMINATION,
                        LofDetector.DEFAULT_NEIGHBORS),
                EnsembleConfig.of(votingMode, weights, 3));
    }

    public EnsembleDetector() {
        this(VotingMode.MAJORITY, null);
    }

    /**
     * One statistical (z-score), one isolation-based and one density-based member.
     */
    public static List<Detector> defaultMembers(double statisticalThreshold, double contamination, int neighbors) {
        return List.of(
                new StatisticalDetector(statisticalThreshold, StatisticalMethod.ZSCORE),
                new IsolationForestDetector(contamination),
                new LofDetector(neighbors, contamination));
    }

    @Override
    public void fit(double[] data) {
        requireNonEmpty(data, name);
        List<Integer> fittedMembers = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        RuntimeException lastError = null;

        for (int i = 0; i < members.size(); i++) {
            Detector member = members.get(i);
            try {
                member.fit(data);
                fittedMembers.add(i);
            } catch (RuntimeException e) {
                lastError = e;
                failed.add(member.getName());
                log.warn("{} failed to fit and is excluded from the ensemble: {}", member.getName(), e.getMessage());
                failureListener.onFailure(member, "fit", e);
            }
        }

        if (fittedMembers.isEmpty()) {
            throw new AnomalyDetectionException("Every ensemble member failed to fit", lastError);
        }

        List<String> names = new ArrayList<>();
        for (Detector member : members) {
            names.add(member.getName());
        }
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("voting", config.getVotingMode().getValue());
        meta.put("n_detectors", members.size());
        meta.put("detector_names", List.copyOf(names));
        meta.put("weights", config.getWeights());
        meta.put("failed_detectors", List.copyOf(failed));

        this.survivors = List.copyOf(fittedMembers);
        publishMetadata(meta);
        this.fitted = true;
        log.info("Ensemble fitted with {}/{} members ({} voting)",
                fittedMembers.size(), members.size(), config.getVotingMode().getValue());
    }

    @Override
    public double[] score(double[] data) {
        return combine(data).scores();
    }

    @Override
    public int[] predict(double[] data) {
        return thresholded(score(data), threshold);
    }

    @Override
    public DetectionResult predictWithScores(double[] data) {
        Combined combined = combine(data);
        double boundary = threshold;
        double[] scores = combined.scores();
        double[] confidence = new double[scores.length];
        for (int i = 0; i < scores.length; i++) {
            confidence[i] = Math.abs(scores[i] - 0.5) * 2.0;
        }

        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.put("contributing_detectors", combined.contributors());

        return DetectionResult.baseBuilder(name, thresholded(scores, boundary), scores, boundary, meta)
                .confidence(DetectionResult.toList(confidence))
                .votingMode(config.getVotingMode().getValue())
                .build();
    }

    private Combined combine(double[] data) {
        checkFitted();
        return config.getVotingMode() == VotingMode.MAJORITY ? majority(data) : weighted(data);
    }

    private Combined majority(double[] data) {
        double[] votes = new double[data.length];
        List<String> contributors = new ArrayList<>();
        for (int idx : survivors) {
            Detector member = members.get(idx);
            int[] predictions;
            try {
                predictions = member.predict(data);
            } catch (RuntimeException e) {
                memberFailed(member, e);
                continue;
            }
            for (int i = 0; i < votes.length; i++) {
                votes[i] += predictions[i];
            }
            contributors.add(member.getName());
        }
        requireContributors(contributors);

        int voters = contributors.size();
        for (int i = 0; i < votes.length; i++) {
            votes[i] /= voters;
        }
        return new Combined(votes, List.copyOf(contributors));
    }

    private Combined weighted(double[] data) {
        double[] blended = new double[data.length];
        List<String> contributors = new ArrayList<>();
        for (int idx : survivors) {
            Detector member = members.get(idx);
            double[] memberScores;
            try {
                memberScores = member.score(data);
            } catch (RuntimeException e) {
                memberFailed(member, e);
                continue;
            }
            double[] normalized = unitRange(memberScores);
            double weight = config.weightAt(idx);
            for (int i = 0; i < blended.length; i++) {
                blended[i] += weight * normalized[i];
            }
            contributors.add(member.getName());
        }
        requireContributors(contributors);
        return new Combined(blended, List.copyOf(contributors));
    }

    /**
     * Min-max scale to [0, 1]. A constant vector carries no ranking, so its values are only
     * clamped into [0, 1].
     */
    static double[] unitRange(double[] scores) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double s : scores) {
            min = Math.min(min, s);
            max = Math.max(max, s);
        }
        double[] out = new double[scores.length];
        for (int i = 0; i < scores.length; i++) {
            out[i] = max > min ? (scores[i] - min) / (max - min) : Math.min(1.0, Math.max(0.0, scores[i]));
        }
        return out;
    }

    private void memberFailed(Detector member, RuntimeException e) {
        log.warn("{} failed to score and is skipped for this call: {}", member.getName(), e.getMessage());
        failureListener.onFailure(member, "score", e);
    }

    private void requireContributors(List<String> contributors) {
        if (contributors.isEmpty()) {
            throw new NoVerdictException("No ensemble member produced a result for this call");
        }
    }

    public void setMemberFailureListener(MemberFailureListener listener) {
        this.failureListener = listener == null ? (member, phase, error) -> { } : listener;
    }

    public List<Detector> getMembers() {
        return members;
    }

    public List<Detector> getSurvivingMembers() {
        List<Detector> out = new ArrayList<>();
        for (int idx : survivors) {
            out.add(members.get(idx));
        }
        return Collections.unmodifiableList(out);
    }

    public EnsembleConfig getConfig() {
        return config;
    }

    private record Combined(double[] scores, List<String> contributors) {}
}
