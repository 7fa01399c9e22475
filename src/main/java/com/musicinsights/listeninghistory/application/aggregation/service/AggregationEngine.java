package com.musicinsights.listeninghistory.application.aggregation.service;

import com.musicinsights.listeninghistory.application.aggregation.dto.AggregationSet;
import com.musicinsights.listeninghistory.application.aggregation.dto.DateFrequency;
import com.musicinsights.listeninghistory.application.aggregation.dto.DayPattern;
import com.musicinsights.listeninghistory.application.aggregation.dto.Grouping;
import com.musicinsights.listeninghistory.application.aggregation.dto.HourPattern;
import com.musicinsights.listeninghistory.application.aggregation.dto.TopArtist;
import com.musicinsights.listeninghistory.application.aggregation.dto.TopTrack;
import com.musicinsights.listeninghistory.application.common.config.ListeningPipelineProperties;
import com.musicinsights.listeninghistory.application.listening.model.ListeningEvent;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.ToLongFunction;

/**
 * 사용자 전체 청취 이벤트로 다섯 종류의 집계를 계산한다.
 *
 * <ul>
 *     <li>날짜 빈도: day/month/year 단위, 구간 시작일 오름차순</li>
 *     <li>시간대: 0~23시 24개 구간(0건 구간 포함)</li>
 *     <li>요일: 0=일요일 ~ 6=토요일 7개 구간(0건 구간 포함)</li>
 *     <li>Top 트랙/아티스트: 재생 수 내림차순, 동률은 먼저 등장한 항목이 앞선다</li>
 * </ul>
 *
 * <p>증분 계산 없이 항상 전체 기록으로 다시 계산한다.</p>
 */
@Component
public class AggregationEngine {

    private static final String[] DAY_NAMES =
            {"Sunday", "Monday", "Tuesday", "Wednesday", "Thursday", "Friday", "Saturday"};

    private static final DateTimeFormatter MONTH_KEY = DateTimeFormatter.ofPattern("yyyy-MM");

    private final ZoneId zone;
    private final int topLimit;

    public AggregationEngine(ListeningPipelineProperties props) {
        this(props.getAggregation().getZoneId(), props.getAggregation().getTopLimit());
    }

    AggregationEngine(ZoneId zone, int topLimit) {
        this.zone = zone;
        this.topLimit = topLimit;
    }

    /**
     * 전체 집계를 계산한다.
     *
     * @param events 사용자 전체 이벤트(저장 순서)
     * @return 집계 결과
     */
    public AggregationSet compute(List<ListeningEvent> events) {
        Map<Grouping, List<DateFrequency>> dates = new EnumMap<>(Grouping.class);
        for (Grouping g : Grouping.values()) {
            dates.put(g, dateFrequency(events, g));
        }
        return new AggregationSet(
                dates,
                timeOfDay(events),
                dayOfWeek(events),
                topTracks(events),
                topArtists(events)
        );
    }

    List<DateFrequency> dateFrequency(List<ListeningEvent> events, Grouping grouping) {
        Map<LocalDate, long[]> buckets = new TreeMap<>();
        for (ListeningEvent e : events) {
            LocalDate start = periodStart(e.playedAt().atZone(zone).toLocalDate(), grouping);
            long[] acc = buckets.computeIfAbsent(start, k -> new long[2]);
            acc[0]++;
            acc[1] += e.durationMs();
        }

        List<DateFrequency> out = new ArrayList<>(buckets.size());
        buckets.forEach((start, acc) -> out.add(new DateFrequency(periodKey(start, grouping), start, acc[0], acc[1])));
        return out;
    }

    List<HourPattern> timeOfDay(List<ListeningEvent> events) {
        long[] counts = new long[24];
        for (ListeningEvent e : events) {
            counts[e.playedAt().atZone(zone).getHour()]++;
        }

        List<HourPattern> out = new ArrayList<>(24);
        for (int h = 0; h < 24; h++) {
            out.add(new HourPattern(h, counts[h]));
        }
        return out;
    }

    List<DayPattern> dayOfWeek(List<ListeningEvent> events) {
        long[] counts = new long[7];
        for (ListeningEvent e : events) {
            ZonedDateTime at = e.playedAt().atZone(zone);
            // ISO 요일(월=1..일=7)을 0=일요일 기준으로 변환
            counts[at.getDayOfWeek().getValue() % 7]++;
        }

        List<DayPattern> out = new ArrayList<>(7);
        for (int d = 0; d < 7; d++) {
            out.add(new DayPattern(d, DAY_NAMES[d], counts[d]));
        }
        return out;
    }

    List<TopTrack> topTracks(List<ListeningEvent> events) {
        return top(events,
                e -> new TrackKey(e.trackName(), e.artistName()),
                (key, acc) -> new TopTrack(key.trackName(), key.artistName(), acc[0], acc[1]),
                TopTrack::playCount);
    }

    List<TopArtist> topArtists(List<ListeningEvent> events) {
        return top(events,
                ListeningEvent::artistName,
                (key, acc) -> new TopArtist(key, acc[0], acc[1]),
                TopArtist::playCount);
    }

    /**
     * 키별 재생 수/재생 시간을 누적한 뒤 재생 수 내림차순으로 정렬해 상위 N개를 반환한다.
     * <p>
     * 첫 등장 순서를 보존하는 {@link LinkedHashMap}과 안정 정렬을 사용하므로 동률은 먼저 등장한 항목이 앞선다.
     */
    private <K, R> List<R> top(List<ListeningEvent> events,
                               Function<ListeningEvent, K> keyFn,
                               BiFunction<K, long[], R> toResult,
                               ToLongFunction<R> playCount) {
        Map<K, long[]> acc = new LinkedHashMap<>();
        for (ListeningEvent e : events) {
            long[] a = acc.computeIfAbsent(keyFn.apply(e), k -> new long[2]);
            a[0]++;
            a[1] += e.durationMs();
        }

        List<R> out = new ArrayList<>(acc.size());
        acc.forEach((k, a) -> out.add(toResult.apply(k, a)));
        out.sort(Comparator.comparingLong(playCount).reversed());
        return out.size() > topLimit ? new ArrayList<>(out.subList(0, topLimit)) : out;
    }

    private static LocalDate periodStart(LocalDate date, Grouping grouping) {
        switch (grouping) {
            case MONTH:
                return date.withDayOfMonth(1);
            case YEAR:
                return date.withDayOfYear(1);
            default:
                return date;
        }
    }

    private static String periodKey(LocalDate start, Grouping grouping) {
        switch (grouping) {
            case MONTH:
                return start.format(MONTH_KEY);
            case YEAR:
                return String.valueOf(start.getYear());
            default:
                return start.toString();
        }
    }

    /** Top 트랙 그룹 키 */
    private record TrackKey(String trackName, String artistName) {}
}
