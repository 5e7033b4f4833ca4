package com.itinera.server.planner;

import com.itinera.pojo.entity.Place;
import com.itinera.pojo.entity.PlaceKind;

import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * 每日主题的分类桶。主题文字命中触发词即归入该桶，按声明顺序取第一个命中的。
 */
public enum ThemeBucket {

    HISTORIC(List.of("historic"),
            List.of("historic", "old", "ancient", "cathedral", "palace", "monument")),
    MUSEUM_CULTURE(List.of("museum", "culture"),
            List.of("museum", "gallery", "art", "cultural", "exhibition")),
    FOOD_MARKET(List.of("food", "market"),
            List.of("market", "food", "restaurant")),
    NATURE_PARK(List.of("nature", "park"),
            List.of("park", "garden", "nature", "outdoor", "beach", "mountain")),
    NEIGHBORHOOD_LOCAL(List.of("neighborhood", "neighbourhood", "local"),
            List.of("neighborhood", "neighbourhood", "local", "district", "quarter")),
    DEFAULT(Collections.emptyList(), Collections.emptyList());

    private final List<String> triggers;
    private final List<String> placeKeywords;

    ThemeBucket(List<String> triggers, List<String> placeKeywords) {
        this.triggers = triggers;
        this.placeKeywords = placeKeywords;
    }

    public static ThemeBucket classify(String theme) {
        if (theme == null) {
            return DEFAULT;
        }
        String lower = theme.toLowerCase(Locale.ROOT);
        for (ThemeBucket bucket : values()) {
            if (bucket.triggers.stream().anyMatch(lower::contains)) {
                return bucket;
            }
        }
        return DEFAULT;
    }

    public boolean matches(Place place) {
        return switch (this) {
            case DEFAULT -> true;
            case FOOD_MARKET -> place.getKind() == PlaceKind.ESTABLISHMENT || containsKeyword(place);
            default -> containsKeyword(place);
        };
    }

    private boolean containsKeyword(Place place) {
        String text = place.getSearchText();
        return placeKeywords.stream().anyMatch(text::contains);
    }
}
