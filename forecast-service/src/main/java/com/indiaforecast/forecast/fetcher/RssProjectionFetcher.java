package com.indiaforecast.forecast.fetcher;

import com.indiaforecast.common.exception.SourceParseException;
import com.indiaforecast.common.model.ForecastRecord;
import com.indiaforecast.common.model.Prediction;
import com.indiaforecast.common.model.RawConfidence;
import com.indiaforecast.common.model.Sector;
import com.indiaforecast.common.model.SourceId;
import com.indiaforecast.common.model.TrustTier;
import com.indiaforecast.forecast.config.FetchSettings;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Forecasts and open targets mentioned in a source's RSS feed.
 *
 * <p>Each call downloads the feed once and scans every {@code <item>}: the title and
 * description must mention one of the sector's keywords and carry a phrase
 * {@link ProjectionExtractor} understands. The item's {@code pubDate} year is the year the
 * forecast was made.
 *
 * <p>A feed only carries recent items, so years older than {@link #FEED_HORIZON_YEARS}
 * before now are not covered. An item whose figures cannot form a valid prediction is
 * skipped; only a response that is not a feed at all is a parse error.
 */
public class RssProjectionFetcher implements SourceFetcher {

    private static final Logger log = LoggerFactory.getLogger(RssProjectionFetcher.class);

    static final int FEED_HORIZON_YEARS = 1;

    private final SourceId source;
    private final WebClient webClient;
    private final FetchSettings settings;
    private final Clock clock;

    public RssProjectionFetcher(SourceId source, WebClient feedWebClient, FetchSettings settings, Clock clock) {
        this.source    = source;
        this.webClient = feedWebClient;
        this.settings  = settings;
        this.clock     = clock;
    }

    /** One parsed feed entry. {@code published} is null when the feed omits or garbles the date. */
    record FeedItem(String title, String description, String link, LocalDate published) {
        String text() {
            return title + ". " + description;
        }
    }

    @Override
    public SourceId source() {
        return source;
    }

    @Override
    public boolean covers(int year) {
        return year >= LocalDate.now(clock).getYear() - FEED_HORIZON_YEARS;
    }

    @Override
    public Mono<List<ForecastRecord>> fetchHistorical(int forecastYear, int targetYear, Sector sector) {
        return feed("historical " + sector + " " + forecastYear + "->" + targetYear)
            .map(items -> {
                List<ForecastRecord> records = new ArrayList<>();
                for (FeedItem item : items) {
                    if (item.published() == null || item.published().getYear() != forecastYear
                        || !SectorKeywords.matches(sector, item.text())) {
                        continue;
                    }
                    ProjectionExtractor.projection(item.text())
                        .filter(p -> p.targetYear() == targetYear)
                        .ifPresent(p -> records.add(new ForecastRecord(
                            p.metric(), p.value(), source, sector, forecastYear, targetYear,
                            item.link(), rawConfidence())));
                }
                log.debug("Feed scanned. source={} sector={} forecasts={}", source, sector, records.size());
                return records;
            });
    }

    @Override
    public Mono<Prediction> fetchCurrent(int targetYear, Sector sector) {
        return feed("current " + sector + " " + targetYear)
            .flatMap(items -> Mono.justOrEmpty(firstPrediction(items, targetYear, sector)));
    }

    private Optional<Prediction> firstPrediction(List<FeedItem> items, int targetYear, Sector sector) {
        for (FeedItem item : items) {
            if (!SectorKeywords.matches(sector, item.text())) {
                continue;
            }
            Optional<ProjectionExtractor.Progress> match = ProjectionExtractor.progress(item.text())
                .filter(p -> p.targetYear() == targetYear);
            if (match.isEmpty()) {
                continue;
            }
            ProjectionExtractor.Progress p = match.get();
            int announced = p.announcementYear().orElse(
                item.published() != null ? item.published().getYear() : LocalDate.now(clock).getYear());
            try {
                return Optional.of(new Prediction(p.metric(), p.target(), p.progress(), source, sector,
                    announced, targetYear, item.link(), rawConfidence()));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping feed item. source={} sector={} title='{}' reason={}",
                    source, sector, item.title(), e.getMessage());
            }
        }
        return Optional.empty();
    }

    private Mono<List<FeedItem>> feed(String operation) {
        Mono<String> call = webClient.get()
            .retrieve()
            .bodyToMono(String.class);
        return FetchRetrySupport.withRetry(call, source, operation, settings)
            .map(this::parseFeed);
    }

    List<FeedItem> parseFeed(String xml) {
        Document doc = Jsoup.parse(xml, "", Parser.xmlParser());
        if (doc.selectFirst("rss > channel, channel") == null) {
            throw new SourceParseException(source, "response is not an RSS feed");
        }
        List<FeedItem> items = new ArrayList<>();
        for (Element item : doc.select("item")) {
            items.add(new FeedItem(
                text(item, "title"),
                Jsoup.parse(text(item, "description")).text(),
                text(item, "link"),
                published(text(item, "pubDate"))));
        }
        return items;
    }

    private static String text(Element item, String tag) {
        Element el = item.selectFirst(tag);
        return el == null ? "" : el.text().trim();
    }

    private LocalDate published(String pubDate) {
        if (pubDate.isBlank()) {
            return null;
        }
        try {
            return ZonedDateTime.parse(pubDate, DateTimeFormatter.RFC_1123_DATE_TIME).toLocalDate();
        } catch (DateTimeParseException e) {
            log.debug("Unparseable pubDate. source={} value={}", source, pubDate);
            return null;
        }
    }

    private RawConfidence rawConfidence() {
        return source.trustTier() == TrustTier.NEWS_ARCHIVE ? RawConfidence.LOW : RawConfidence.MEDIUM;
    }
}
