package org.hypertrace.core.panelquery.opentsdb;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.JsonSyntaxException;
import com.google.gson.TypeAdapter;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import java.io.IOException;
import java.lang.reflect.Type;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import org.hypertrace.core.panelquery.api.Annotation;
import org.hypertrace.core.panelquery.api.RawSeries;

/**
 * Parses the series array returned by {@code /api/query} and {@code /api/query/gexp}. The reader
 * is lenient so that bare {@code NaN} values from the {@code nan} fill policy are accepted.
 */
public class OpenTsdbResponseParser {

  private static final Type RAW_SERIES_LIST_TYPE = new TypeToken<List<RawSeries>>() {}.getType();

  private static final Gson GSON =
      new GsonBuilder()
          .registerTypeAdapter(
              RawSeries.class,
              new TypeAdapter<RawSeries>() {
                @Override
                public RawSeries read(JsonReader reader) throws IOException {
                  return parseSeries(reader);
                }

                @Override
                public void write(JsonWriter writer, RawSeries series) throws IOException {
                  throw new UnsupportedOperationException("series are only ever read");
                }
              })
          .create();

  /**
   * @throws JsonParseException when the body is not an array of series
   */
  public static List<RawSeries> parse(String jsonString) {
    List<RawSeries> series;
    try {
      series = GSON.fromJson(jsonString, RAW_SERIES_LIST_TYPE);
    } catch (NumberFormatException e) {
      // JsonReader reports a non-numeric dp value or a fractional query index this way
      throw new JsonSyntaxException(e);
    }
    return series == null ? List.of() : series;
  }

  private static RawSeries parseSeries(JsonReader reader) throws IOException {
    RawSeries.RawSeriesBuilder seriesBuilder = RawSeries.builder();
    boolean hasMetric = false;

    reader.beginObject();
    while (reader.hasNext()) {
      String propertyName = reader.nextName();
      switch (propertyName) {
        case "metric":
          seriesBuilder.metric(reader.nextString());
          hasMetric = true;
          break;
        case "tags":
          parseStringMap(reader, seriesBuilder::tag);
          break;
        case "aggregateTags":
          parseAggregateTags(reader, seriesBuilder);
          break;
        case "dps":
          parseDataPoints(reader, seriesBuilder);
          break;
        case "query":
          parseQueryIndex(reader, seriesBuilder);
          break;
        case "annotations":
          parseAnnotations(reader, seriesBuilder::annotation);
          break;
        case "globalAnnotations":
          parseAnnotations(reader, seriesBuilder::globalAnnotation);
          break;
        default:
          reader.skipValue();
      }
    }
    reader.endObject();

    if (!hasMetric) {
      throw new JsonParseException("Series without a metric name at " + reader.getPath());
    }
    return seriesBuilder.build();
  }

  private static void parseStringMap(JsonReader reader, BiConsumer<String, String> consumer)
      throws IOException {
    if (skipNull(reader)) {
      return;
    }
    reader.beginObject();
    while (reader.hasNext()) {
      String key = reader.nextName();
      if (!skipNull(reader)) {
        consumer.accept(key, reader.nextString());
      }
    }
    reader.endObject();
  }

  private static void parseAggregateTags(
      JsonReader reader, RawSeries.RawSeriesBuilder seriesBuilder) throws IOException {
    if (skipNull(reader)) {
      return;
    }
    reader.beginArray();
    while (reader.hasNext()) {
      seriesBuilder.aggregateTag(reader.nextString());
    }
    reader.endArray();
  }

  private static void parseDataPoints(JsonReader reader, RawSeries.RawSeriesBuilder seriesBuilder)
      throws IOException {
    if (skipNull(reader)) {
      return;
    }
    // dps is an object of timestamp text to value; a null value is a gap
    reader.beginObject();
    while (reader.hasNext()) {
      String timestamp = reader.nextName();
      seriesBuilder.dp(timestamp, skipNull(reader) ? null : reader.nextDouble());
    }
    reader.endObject();
  }

  private static void parseQueryIndex(JsonReader reader, RawSeries.RawSeriesBuilder seriesBuilder)
      throws IOException {
    if (skipNull(reader)) {
      return;
    }
    reader.beginObject();
    while (reader.hasNext()) {
      String propertyName = reader.nextName();
      if ("index".equals(propertyName) && reader.peek() == JsonToken.NUMBER) {
        seriesBuilder.queryIndex(reader.nextInt());
      } else {
        reader.skipValue();
      }
    }
    reader.endObject();
  }

  private static void parseAnnotations(
      JsonReader reader, Consumer<Annotation> consumer) throws IOException {
    if (skipNull(reader)) {
      return;
    }
    reader.beginArray();
    while (reader.hasNext()) {
      String description = null;
      double startTime = 0;
      reader.beginObject();
      while (reader.hasNext()) {
        String propertyName = reader.nextName();
        if (skipNull(reader)) {
          continue;
        }
        if ("description".equals(propertyName)) {
          description = reader.nextString();
        } else if ("startTime".equals(propertyName)) {
          startTime = reader.nextDouble();
        } else {
          reader.skipValue();
        }
      }
      reader.endObject();
      consumer.accept(new Annotation(description, startTime));
    }
    reader.endArray();
  }

  private static boolean skipNull(JsonReader reader) throws IOException {
    if (reader.peek() == JsonToken.NULL) {
      reader.nextNull();
      return true;
    }
    return false;
  }
}
