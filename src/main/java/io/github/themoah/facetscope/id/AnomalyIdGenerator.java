package io.github.themoah.facetscope.id;

import io.github.themoah.facetscope.model.AnomalyCategory;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Generates stable, human-readable anomaly identifiers such as "opulent-crimson-miata".
 *
 * <p>The id is a pure function of the base time range, the base filters, the anomaly bounds
 * rounded to the nearest minute and the category. Rounding absorbs the bucket-boundary jitter
 * of resampled chart data, so the same anomaly keeps its id across reloads. The color word is
 * picked from a palette matching the category (red, orange or cool).
 *
 * <p>The 32-bit hash can collide for different contexts; ids are an addressing convenience,
 * not a uniqueness guarantee.
 */
public final class AnomalyIdGenerator {

  private static final String SEPARATOR = "|";

  private static final DateTimeFormatter ISO_MILLIS =
    DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

  private static final List<String> ADJECTIVES = List.of(
    "alpine", "azure", "blazing", "bold", "brilliant", "chrome", "classic", "coastal", "cosmic",
    "crimson", "crystal", "daring", "dazzling", "dusty", "electric", "elegant", "ember",
    "emerald", "fierce", "fiery", "flash", "forest", "frozen", "gentle", "gilded", "gleaming",
    "golden", "granite", "hidden", "highland", "icy", "ivory", "jade", "jet", "lunar", "marble",
    "midnight", "misty", "moonlit", "neon", "noble", "obsidian", "ocean", "onyx", "opulent",
    "pearl", "phantom", "polar", "pristine", "radiant", "raven", "royal", "ruby", "rustic",
    "sable", "sapphire", "scarlet", "shadow", "silent", "silver", "sleek", "smoky", "solar",
    "sonic", "speedy", "starlit", "steel", "storm", "sunset", "swift", "teal", "thunder",
    "titan", "turbo", "twilight", "velvet", "vintage", "violet", "wild", "winter", "zephyr"
  );

  private static final List<String> RED_COLORS = List.of(
    "burgundy", "cardinal", "carmine", "cerise", "cherry", "claret", "coral", "cranberry",
    "crimson", "garnet", "magenta", "maroon", "raspberry", "rose", "ruby", "russet", "rust",
    "scarlet", "vermillion", "wine"
  );

  private static final List<String> ORANGE_COLORS = List.of(
    "amber", "apricot", "bronze", "burnt", "butterscotch", "caramel", "carrot", "cinnamon",
    "copper", "flame", "ginger", "gold", "honey", "marigold", "melon", "ochre", "orange",
    "papaya", "peach", "pumpkin", "saffron", "sand", "sienna", "tan", "tangerine", "tawny",
    "topaz", "yellow"
  );

  private static final List<String> COOL_COLORS = List.of(
    "aqua", "azure", "blue", "cerulean", "chartreuse", "cobalt", "cyan", "emerald", "forest",
    "green", "hunter", "indigo", "jade", "lagoon", "lime", "mint", "navy", "olive", "pacific",
    "pine", "sage", "seafoam", "spruce", "teal", "turquoise", "verdant", "viridian"
  );

  private static final List<String> MODELS = List.of(
    "accord", "alpine", "beetle", "boxster", "bronco", "camaro", "camry", "cayenne",
    "challenger", "charger", "civic", "cobra", "continental", "corolla", "corvette", "defender",
    "elantra", "escort", "explorer", "firebird", "focus", "frontier", "fury", "galaxie",
    "giulia", "gto", "impala", "jetta", "lancer", "landcruiser", "maverick", "miata", "monte",
    "mustang", "navigator", "nova", "outback", "panda", "pantera", "passat", "pathfinder",
    "pinto", "porsche", "prelude", "prius", "quattro", "rabbit", "ranger", "raptor", "roadster",
    "safari", "scirocco", "senna", "shelby", "sierra", "skyline", "solara", "sonata", "spark",
    "spider", "stingray", "supra", "tacoma", "tempest", "tercel", "thunderbird", "tiguan",
    "torino", "tundra", "vantage", "viper", "wrangler", "zephyr"
  );

  private AnomalyIdGenerator() {}

  /**
   * Generates the id of an anomaly.
   *
   * @param baseTimeRange resolved time filter of the visible range
   * @param baseFilters active facet filters as SQL
   * @param anomalyStart anomaly start
   * @param anomalyEnd anomaly end
   * @param category anomaly category, selects the color palette
   * @return id of the form adjective-color-model
   */
  public static String generate(
      String baseTimeRange,
      String baseFilters,
      Instant anomalyStart,
      Instant anomalyEnd,
      AnomalyCategory category
  ) {
    String input = String.join(SEPARATOR,
      nullToEmpty(baseTimeRange),
      nullToEmpty(baseFilters),
      roundToMinute(anomalyStart),
      roundToMinute(anomalyEnd));

    long hash = hash(input);
    List<String> colors = colorsFor(category);

    int adjective = (int) (hash % ADJECTIVES.size());
    int color = (int) ((hash / ADJECTIVES.size()) % colors.size());
    int model = (int) ((hash / ((long) ADJECTIVES.size() * colors.size())) % MODELS.size());

    return ADJECTIVES.get(adjective) + "-" + colors.get(color) + "-" + MODELS.get(model);
  }

  /**
   * Key for the durable cache tier. Depends on time and host only: filters can change
   * without changing the key and are checked against the stored context instead.
   */
  public static String cacheKey(String timeFilter, String hostFilter) {
    return Long.toString(hash(nullToEmpty(timeFilter) + SEPARATOR + nullToEmpty(hostFilter)), 36);
  }

  /**
   * Short display label: the first two words of an id.
   */
  public static String label(String anomalyId) {
    int first = anomalyId.indexOf('-');
    int second = first < 0 ? -1 : anomalyId.indexOf('-', first + 1);
    return second < 0 ? anomalyId : anomalyId.substring(0, second);
  }

  /**
   * Rounds to the nearest minute, 30 seconds and above rounding up. Sub-second precision is ignored.
   */
  static String roundToMinute(Instant instant) {
    Instant floor = instant.truncatedTo(ChronoUnit.MINUTES);
    long seconds = instant.getEpochSecond() - floor.getEpochSecond();
    Instant rounded = seconds >= 30 ? floor.plus(1, ChronoUnit.MINUTES) : floor;
    return ISO_MILLIS.format(rounded);
  }

  /**
   * Rolling {@code h = h * 31 + c} over UTF-16 units with 32-bit wraparound, made non-negative.
   */
  static long hash(String input) {
    int h = 0;
    for (int i = 0; i < input.length(); i++) {
      h = h * 31 + input.charAt(i);
    }
    return Math.abs((long) h);
  }

  private static List<String> colorsFor(AnomalyCategory category) {
    if (category == AnomalyCategory.RED) {
      return RED_COLORS;
    }
    if (category == AnomalyCategory.YELLOW) {
      return ORANGE_COLORS;
    }
    return COOL_COLORS;
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
