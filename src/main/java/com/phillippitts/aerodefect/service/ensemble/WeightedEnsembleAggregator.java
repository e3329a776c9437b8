package com.phillippitts.aerodefect.service.ensemble;

import com.phillippitts.aerodefect.config.properties.EnsembleConfig;
import com.phillippitts.aerodefect.domain.DefectClass;
import com.phillippitts.aerodefect.domain.Detection;
import com.phillippitts.aerodefect.domain.DetectionSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Weighted two-detector ensemble.
 *
 * <p>Algorithm:
 * <ol>
 *   <li><b>Agreement:</b> same-class primary/secondary pairs with IoU at or above
 *       {@code matchIouThreshold} are paired greedily, best IoU first, each detection used at most
 *       once. A pair merges into one {@code ENSEMBLE} detection with the averaged box and the mean
 *       confidence.</li>
 *   <li><b>Location vote:</b> every merged detection forms a cluster with the unpaired
 *       detections of other classes that overlap it at {@code matchIouThreshold}. Each class in the
 *       cluster scores the sum of {@code confidence x detector weight} over its members, the merged
 *       detection counting both of its sources. Only the best class survives; a tie keeps the merged
 *       detection. Cluster members are used up either way.</li>
 *   <li><b>Class conflict:</b> among the leftovers, cross-class pairs that overlap at the same
 *       threshold are paired the same way and settled by weighted vote
 *       ({@code confidence x detector weight}); a tie goes to the primary detection. The winner is
 *       kept unchanged, the loser discarded.</li>
 *   <li><b>Uncorroborated:</b> anything still unpaired survives only with confidence above
 *       {@code singleDetectorMinConfidence}, keeping its source.</li>
 *   <li><b>NMS:</b> class-scoped suppression at {@code nmsIouThreshold}.</li>
 *   <li><b>Floor:</b> detections below {@code minFinalConfidence} are dropped.</li>
 * </ol>
 *
 * <p>Stateless; safe to share across jobs.
 */
@Component
public class WeightedEnsembleAggregator extends AbstractAggregator {

    private static final Logger LOG = LogManager.getLogger(WeightedEnsembleAggregator.class);

    private final EnsembleConfig config;

    public WeightedEnsembleAggregator(EnsembleConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    protected List<Detection> doAggregate(List<Detection> primary, List<Detection> secondary) {
        boolean[] primaryUsed = new boolean[primary.size()];
        boolean[] secondaryUsed = new boolean[secondary.size()];
        List<Detection> combined = new ArrayList<>();

        List<Agreement> agreements = new ArrayList<>();
        for (Pair pair : greedyPairs(primary, secondary, primaryUsed, secondaryUsed, true)) {
            Detection p = primary.get(pair.primaryIndex());
            Detection s = secondary.get(pair.secondaryIndex());
            agreements.add(new Agreement(merge(p, s),
                    p.confidence() * config.primaryWeight() + s.confidence() * config.secondaryWeight()));
        }
        agreements.sort(Agreement.STRONGEST_FIRST);
        int merged = agreements.size();

        for (Agreement agreement : agreements) {
            combined.addAll(voteAtLocation(agreement, primary, primaryUsed, secondary, secondaryUsed));
        }

        int conflicts = 0;
        for (Pair pair : greedyPairs(primary, secondary, primaryUsed, secondaryUsed, false)) {
            combined.add(vote(primary.get(pair.primaryIndex()), secondary.get(pair.secondaryIndex())));
            conflicts++;
        }

        int singles = 0;
        singles += keepConfidentSingles(primary, primaryUsed, combined);
        singles += keepConfidentSingles(secondary, secondaryUsed, combined);

        List<Detection> suppressed = NonMaxSuppression.apply(combined, config.nmsIouThreshold());
        List<Detection> result = new ArrayList<>(suppressed.size());
        for (Detection d : suppressed) {
            if (d.confidence() >= config.minFinalConfidence()) {
                result.add(d);
            }
        }

        LOG.debug("Ensemble: primary={}, secondary={}, merged={}, conflicts={}, singles={}, afterNms={}, final={}",
                primary.size(), secondary.size(), merged, conflicts, singles, suppressed.size(), result.size());
        return result;
    }

    /**
     * Pairs detections best-IoU first. Only unused detections take part; chosen ones are marked used.
     *
     * @param sameClass true to pair only same-class detections, false to pair only different classes
     */
    private List<Pair> greedyPairs(List<Detection> primary, List<Detection> secondary,
                                   boolean[] primaryUsed, boolean[] secondaryUsed, boolean sameClass) {
        List<Pair> candidates = new ArrayList<>();
        for (int i = 0; i < primary.size(); i++) {
            if (primaryUsed[i]) {
                continue;
            }
            Detection p = primary.get(i);
            for (int j = 0; j < secondary.size(); j++) {
                if (secondaryUsed[j]) {
                    continue;
                }
                Detection s = secondary.get(j);
                if ((p.defectClass() == s.defectClass()) != sameClass) {
                    continue;
                }
                double iou = p.bbox().iou(s.bbox());
                if (iou >= config.matchIouThreshold()) {
                    candidates.add(new Pair(i, j, iou));
                }
            }
        }
        candidates.sort(Pair.BEST_FIRST);

        List<Pair> chosen = new ArrayList<>();
        for (Pair c : candidates) {
            if (!primaryUsed[c.primaryIndex()] && !secondaryUsed[c.secondaryIndex()]) {
                primaryUsed[c.primaryIndex()] = true;
                secondaryUsed[c.secondaryIndex()] = true;
                chosen.add(c);
            }
        }
        return chosen;
    }

    private static Detection merge(Detection p, Detection s) {
        return new Detection(
                p.defectClass(),
                (p.confidence() + s.confidence()) / 2.0,
                p.bbox().average(s.bbox()),
                DetectionSource.ENSEMBLE);
    }

    /**
     * Settles a merged detection against unpaired detections of other classes at the same spot.
     * Every rival found is marked used.
     *
     * @return the survivors of the cluster: the merged detection, or the winning class's rivals
     */
    private List<Detection> voteAtLocation(Agreement agreement,
                                           List<Detection> primary, boolean[] primaryUsed,
                                           List<Detection> secondary, boolean[] secondaryUsed) {
        Detection merged = agreement.merged();
        List<Detection> rivals = new ArrayList<>();
        List<Double> rivalScores = new ArrayList<>();
        collectRivals(merged, primary, primaryUsed, config.primaryWeight(), rivals, rivalScores);
        collectRivals(merged, secondary, secondaryUsed, config.secondaryWeight(), rivals, rivalScores);
        if (rivals.isEmpty()) {
            return List.of(merged);
        }

        Map<DefectClass, Double> scores = new EnumMap<>(DefectClass.class);
        scores.put(merged.defectClass(), agreement.weightedScore());
        for (int i = 0; i < rivals.size(); i++) {
            scores.merge(rivals.get(i).defectClass(), rivalScores.get(i), Double::sum);
        }
        DefectClass winner = merged.defectClass();
        double best = agreement.weightedScore();
        for (Map.Entry<DefectClass, Double> entry : scores.entrySet()) {
            if (entry.getValue() > best) {
                winner = entry.getKey();
                best = entry.getValue();
            }
        }
        LOG.debug("Location vote at {}: scores={}, keeping {}", merged.bbox(), scores, winner.wireName());

        if (winner == merged.defectClass()) {
            return List.of(merged);
        }
        List<Detection> kept = new ArrayList<>();
        for (Detection rival : rivals) {
            if (rival.defectClass() == winner) {
                kept.add(rival);
            }
        }
        return kept;
    }

    private void collectRivals(Detection merged, List<Detection> detections, boolean[] used, double weight,
                               List<Detection> rivals, List<Double> rivalScores) {
        for (int i = 0; i < detections.size(); i++) {
            Detection d = detections.get(i);
            if (used[i] || d.defectClass() == merged.defectClass()) {
                continue;
            }
            if (merged.bbox().iou(d.bbox()) >= config.matchIouThreshold()) {
                used[i] = true;
                rivals.add(d);
                rivalScores.add(d.confidence() * weight);
            }
        }
    }

    private Detection vote(Detection p, Detection s) {
        double primaryScore = p.confidence() * config.primaryWeight();
        double secondaryScore = s.confidence() * config.secondaryWeight();
        Detection winner = secondaryScore > primaryScore ? s : p;
        LOG.debug("Class conflict {} ({}) vs {} ({}): keeping {}",
                p.defectClass().wireName(), primaryScore, s.defectClass().wireName(), secondaryScore,
                winner.defectClass().wireName());
        return winner;
    }

    private int keepConfidentSingles(List<Detection> detections, boolean[] used, List<Detection> out) {
        int kept = 0;
        for (int i = 0; i < detections.size(); i++) {
            if (!used[i] && detections.get(i).confidence() > config.singleDetectorMinConfidence()) {
                out.add(detections.get(i));
                kept++;
            }
        }
        return kept;
    }

    private record Agreement(Detection merged, double weightedScore) {

        static final Comparator<Agreement> STRONGEST_FIRST = Comparator
                .comparingDouble(Agreement::weightedScore).reversed()
                .thenComparing(Agreement::merged, FINAL_ORDER);
    }

    private record Pair(int primaryIndex, int secondaryIndex, double iou) {

        static final Comparator<Pair> BEST_FIRST = Comparator
                .comparingDouble(Pair::iou).reversed()
                .thenComparingInt(Pair::primaryIndex)
                .thenComparingInt(Pair::secondaryIndex);
    }
}
