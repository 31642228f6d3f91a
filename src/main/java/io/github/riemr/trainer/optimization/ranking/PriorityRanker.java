package io.github.riemr.trainer.optimization.ranking;

import io.github.riemr.trainer.domain.model.BookingRequest;
import io.github.riemr.trainer.domain.model.SchedulingPreferences;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * 配置順を決める優先度スコアの算出。
 * <ul>
 *   <li>既にスコアが付与されたリクエストはその値を使う（範囲に丸める）</li>
 *   <li>未設定なら基本点 + 継続顧客 + 種別 + 時間長 + 特記事項 + 場所 の加算</li>
 *   <li>並び順: スコア降順 → 希望開始が早い順 → ID 昇順（乱数は使わない）</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PriorityRanker {

    static final Comparator<RankedRequest> PLACEMENT_ORDER = Comparator
            .comparingDouble(RankedRequest::score).reversed()
            .thenComparing(r -> r.request().requestedStart(), Comparator.nullsLast(Comparator.<LocalDateTime>naturalOrder()))
            .thenComparing(r -> r.request().getId(), Comparator.nullsLast(Comparator.<Long>naturalOrder()));

    private final PriorityWeights weights;

    public List<RankedRequest> rank(Collection<BookingRequest> requests, SchedulingPreferences prefs) {
        List<RankedRequest> ranked = requests.stream()
                .map(r -> new RankedRequest(r, score(r, prefs)))
                .sorted(PLACEMENT_ORDER)
                .toList();
        if (log.isDebugEnabled()) {
            for (RankedRequest r : ranked) {
                log.debug("Ranked request id={} score={} type={} duration={}",
                        r.request().getId(), r.score(), r.request().getTrainingType(), r.request().getDurationMinutes());
            }
        }
        return ranked;
    }

    public double score(BookingRequest request, SchedulingPreferences prefs) {
        if (request.getPriorityScore() != null) {
            return clamp(request.getPriorityScore());
        }
        double score = weights.getBaseScore();

        if (request.isRecurring() && prefs.isPrioritizeRecurringClients()) {
            score += weights.getRecurringClientBonus();
        }
        score += weights.trainingTypeWeight(request.getTrainingType());
        if (durationBonusApplies(prefs)) {
            score += durationBonus(request.getDurationMinutes());
        }
        score += specialRequestBonus(request.getSpecialRequests());
        score += weights.locationTypeWeight(request.getLocationType());

        return clamp(Math.round(score * 10.0) / 10.0);
    }

    boolean durationBonusApplies(SchedulingPreferences prefs) {
        if (weights.getDurationBonusPolicy() == DurationBonusPolicy.ALWAYS) return true;
        Boolean flag = prefs.getPrioritizeHighValueSessions();
        return flag == null || flag;
    }

    static double durationBonus(Integer minutes) {
        int m = minutes == null ? 0 : minutes;
        if (m >= 120) return 1.5;
        if (m >= 90) return 1.0;
        if (m >= 60) return 0.5;
        return 0.2;
    }

    double specialRequestBonus(String text) {
        if (text == null || text.isBlank()) return 0.0;
        String lower = text.toLowerCase(Locale.ROOT);
        for (String marker : weights.getBoilerplateMarkers()) {
            if (marker != null && !marker.isBlank() && lower.contains(marker.toLowerCase(Locale.ROOT))) {
                return weights.getBoilerplateSpecialRequestBonus();
            }
        }
        return weights.getSpecialRequestBonus();
    }

    private double clamp(double v) {
        return Math.max(weights.getMinScore(), Math.min(weights.getMaxScore(), v));
    }
}
