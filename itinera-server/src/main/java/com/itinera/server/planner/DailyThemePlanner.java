package com.itinera.server.planner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.itinera.common.exception.ContentGenerationException;
import com.itinera.pojo.dto.DailyThemesDTO;
import com.itinera.pojo.dto.TripRequestDTO;
import com.itinera.pojo.entity.Place;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 为每一天生成一个主题。生成失败时按固定列表轮换；数量不足时补 "Exploration Day N"，多出的截掉。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DailyThemePlanner {

    static final String CALL_SITE = "daily-themes";
    static final List<String> FALLBACK_THEMES = List.of(
            "Historic City Center",
            "Museums & Culture",
            "Local Neighborhoods",
            "Nature & Parks",
            "Food & Markets",
            "Hidden Gems",
            "Relaxation Day");

    private final ContentGenerationService contentGenerationService;
    private final GenerationRetryPolicy generationRetryPolicy;
    private final ObjectMapper objectMapper;

    /**
     * @return 长度恰好等于行程天数
     */
    public List<String> planThemes(TripRequestDTO trip, List<Place> workingSet) {
        int totalDays = trip.totalDays();
        List<String> themes;
        try {
            String payload = buildPayload(trip, workingSet);
            themes = generationRetryPolicy.execute(CALL_SITE, () -> {
                DailyThemesDTO dto = contentGenerationService.generate(payload, DailyThemesDTO.class);
                List<String> usable = dto.getThemes() == null ? new ArrayList<>() : dto.getThemes().stream()
                        .filter(StringUtils::hasText)
                        .map(String::trim)
                        .collect(Collectors.toList());
                if (usable.isEmpty()) {
                    throw new ContentGenerationException("没有返回任何主题");
                }
                return usable;
            });
        } catch (ContentGenerationException e) {
            log.warn("每日主题生成失败，使用默认主题轮换: {}", e.getMessage());
            themes = fallbackThemes(totalDays);
        }
        return fitToDays(themes, totalDays);
    }

    static List<String> fallbackThemes(int totalDays) {
        List<String> themes = new ArrayList<>(totalDays);
        for (int i = 0; i < totalDays; i++) {
            themes.add(FALLBACK_THEMES.get(i % FALLBACK_THEMES.size()));
        }
        return themes;
    }

    static List<String> fitToDays(List<String> themes, int totalDays) {
        List<String> result = new ArrayList<>(themes.subList(0, Math.min(themes.size(), totalDays)));
        while (result.size() < totalDays) {
            result.add("Exploration Day " + (result.size() + 1));
        }
        return result;
    }

    private String buildPayload(TripRequestDTO trip, List<Place> workingSet) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("destination", trip.getDestination());
        context.put("days", trip.totalDays());
        context.put("groupType", trip.getGroupType() == null ? null : trip.getGroupType().name());
        context.put("interests", trip.getInterests());
        context.put("places", workingSet.stream()
                .map(p -> p.getName() + " (" + p.getKind() + ")")
                .collect(Collectors.toList()));
        try {
            return "Give each day of the trip a short theme such as \"Historic City Center\" or \"Food & Markets\", "
                    + "one theme per day, in day order, based on the places that are available.\n"
                    + "Context (JSON): " + objectMapper.writeValueAsString(context);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("序列化主题上下文失败", e);
        }
    }
}
