package io.github.themoah.facetscope.cache;

import io.github.themoah.facetscope.context.QueryContext;
import io.github.themoah.facetscope.model.Contributor;
import io.github.themoah.facetscope.model.InvestigationResult;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON encoding of {@link CacheEntry}.
 */
public final class CacheEntryCodec {

  private CacheEntryCodec() {}

  public static String encode(CacheEntry entry) {
    JsonArray results = new JsonArray();
    entry.results().forEach(r -> results.add(r.toJson()));
    JsonArray top = new JsonArray();
    entry.topContributors().forEach(c -> top.add(c.toJson()));

    JsonObject json = new JsonObject()
      .put("results", results)
      .put("topContributors", top)
      .put("version", entry.version())
      .put("timestamp", entry.timestamp());
    if (entry.context() != null) {
      json.put("context", entry.context().toJson());
    }
    return json.encode();
  }

  /**
   * Decodes an entry.
   *
   * @throws DecodeException if the text is not a well-formed entry
   */
  public static CacheEntry decode(String text) {
    JsonObject json;
    try {
      json = new JsonObject(text);
    } catch (RuntimeException e) {
      throw new DecodeException("Cache entry is not a JSON object: " + e.getMessage());
    }
    try {
      List<InvestigationResult> results = new ArrayList<>();
      JsonArray resultsJson = json.getJsonArray("results");
      if (resultsJson == null) {
        throw new DecodeException("Cache entry has no results");
      }
      for (Object item : resultsJson) {
        results.add(InvestigationResult.fromJson((JsonObject) item));
      }

      List<Contributor> top = new ArrayList<>();
      JsonArray topJson = json.getJsonArray("topContributors");
      if (topJson != null) {
        for (Object item : topJson) {
          top.add(Contributor.fromJson((JsonObject) item));
        }
      }

      JsonObject contextJson = json.getJsonObject("context");
      QueryContext context = contextJson == null ? null : QueryContext.fromJson(contextJson);

      return new CacheEntry(
        results,
        top,
        context,
        json.getInteger("version", 0),
        json.getLong("timestamp", 0L)
      );
    } catch (DecodeException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new DecodeException("Malformed cache entry: " + e.getMessage());
    }
  }

  /**
   * Reads only the write timestamp, 0 when the entry cannot be parsed.
   */
  public static long timestampOf(String text) {
    try {
      Object value = new JsonObject(text).getValue("timestamp");
      return value instanceof Number number ? number.longValue() : 0L;
    } catch (RuntimeException e) {
      return 0L;
    }
  }
}
