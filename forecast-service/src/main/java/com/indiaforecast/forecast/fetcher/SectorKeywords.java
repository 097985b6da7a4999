package com.indiaforecast.forecast.fetcher;

import com.indiaforecast.common.model.Sector;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Search terms that tie a headline or metric name to a sector. */
public final class SectorKeywords {

    private static final Map<Sector, List<String>> KEYWORDS = new EnumMap<>(Sector.class);

    static {
        KEYWORDS.put(Sector.ECONOMY, List.of("gdp", "economic growth", "economy", "inflation", "fiscal deficit", "per capita income"));
        KEYWORDS.put(Sector.ENERGY, List.of("renewable", "solar", "wind", "power", "electricity", "energy", "coal"));
        KEYWORDS.put(Sector.INFRASTRUCTURE, List.of("highway", "road", "railway", "metro", "airport", "port", "infrastructure"));
        KEYWORDS.put(Sector.TECHNOLOGY, List.of("digital", "internet", "broadband", "5g", "semiconductor", "technology"));
        KEYWORDS.put(Sector.AGRICULTURE, List.of("farm", "crop", "foodgrain", "agricultur", "irrigation", "farmers"));
        KEYWORDS.put(Sector.EDUCATION, List.of("literacy", "school", "enrolment", "enrollment", "education", "university"));
        KEYWORDS.put(Sector.HEALTHCARE, List.of("health", "hospital", "life expectancy", "mortality", "vaccination"));
        KEYWORDS.put(Sector.ENVIRONMENT, List.of("emission", "carbon", "forest", "pollution", "climate"));
        KEYWORDS.put(Sector.SOCIAL_DEVELOPMENT, List.of("poverty", "housing", "sanitation", "population", "employment"));
    }

    private SectorKeywords() {}

    public static boolean matches(Sector sector, String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return KEYWORDS.getOrDefault(sector, List.of()).stream().anyMatch(lower::contains);
    }

    public static List<String> keywords(Sector sector) {
        return KEYWORDS.getOrDefault(sector, List.of());
    }
}
