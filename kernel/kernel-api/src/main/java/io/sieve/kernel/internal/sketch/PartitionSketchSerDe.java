/*
 * Copyright (2026) The Sieve Project Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.sieve.kernel.internal.sketch;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import io.sieve.kernel.exceptions.CorruptSketchException;
import io.sieve.kernel.internal.SieveErrors;
import io.sieve.kernel.internal.hash.BlockedBloomFilter;
import io.sieve.kernel.internal.util.JsonUtils;
import io.sieve.kernel.sketch.FieldSketch;
import io.sieve.kernel.sketch.PartitionInfo;
import io.sieve.kernel.sketch.PartitionSketch;
import io.sieve.kernel.synopsis.*;
import io.sieve.kernel.types.*;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.*;

/**
 * Encodes a {@link PartitionSketch} as UTF-8 JSON:
 *
 * <pre>{@code
 * {
 *   "version": 1, "partitionId": "...", "schemaName": "zeek.conn", "events": 1000, "offset": 0,
 *   "minImportTime": ..., "maxImportTime": ...,
 *   "fields": [{"name": "id.orig_h", "type": "string", "synopsis": {...}}, ...],
 *   "typeSynopses": {"long": {...}, ...}
 * }
 * }</pre>
 *
 * A synopsis is either {@code {"kind": "bloomfilter", "type", "n", "p", "numBlocks",
 * "numHashFunctions", "payload"}}, with the filter words little-endian and base64 encoded, or
 * {@code {"kind": "minmax", "type", "min", "max"}}. Double bounds are written as strings so that
 * infinities survive.
 */
public final class PartitionSketchSerDe {
  public static final int VERSION = 1;

  private PartitionSketchSerDe() {}

  public static byte[] serialize(PartitionSketch sketch) {
    return JsonUtils.generateBytes(generator -> writeSketch(generator, sketch));
  }

  /**
   * @param partitionId the partition the blob was registered for
   * @throws CorruptSketchException if the blob cannot be decoded, has an unsupported version or
   *     describes another partition
   */
  public static PartitionSketch deserialize(UUID partitionId, byte[] blob) {
    if (blob == null) {
      throw SieveErrors.corruptSketch(partitionId, "no blob", null);
    }
    JsonNode root;
    try {
      root = JsonUtils.mapper().readTree(blob);
    } catch (IOException | RuntimeException e) {
      throw SieveErrors.corruptSketch(partitionId, "invalid JSON", e);
    }
    if (root == null || root.isMissingNode() || !root.isObject()) {
      throw SieveErrors.corruptSketch(partitionId, "not a JSON object", null);
    }
    try {
      return readSketch(partitionId, root);
    } catch (CorruptSketchException e) {
      throw e;
    } catch (RuntimeException e) {
      throw SieveErrors.corruptSketch(partitionId, e.getMessage(), e);
    }
  }

  ////////////
  // Writer //
  ////////////

  private static void writeSketch(JsonGenerator gen, PartitionSketch sketch) throws IOException {
    PartitionInfo info = sketch.getInfo();
    gen.writeStartObject();
    gen.writeNumberField("version", VERSION);
    gen.writeStringField("partitionId", info.getPartitionId().toString());
    gen.writeStringField("schemaName", info.getSchemaName());
    gen.writeNumberField("events", info.getEvents());
    gen.writeNumberField("offset", info.getOffset());
    gen.writeNumberField("minImportTime", info.getMinImportTime());
    gen.writeNumberField("maxImportTime", info.getMaxImportTime());
    gen.writeArrayFieldStart("fields");
    for (FieldSketch field : sketch.getFields()) {
      gen.writeStartObject();
      gen.writeStringField("name", field.getName());
      gen.writeStringField("type", field.getType().toString());
      if (field.getSynopsis().isPresent()) {
        gen.writeFieldName("synopsis");
        writeSynopsis(gen, field.getSynopsis().get());
      }
      gen.writeEndObject();
    }
    gen.writeEndArray();
    gen.writeObjectFieldStart("typeSynopses");
    for (Map.Entry<DataType, Synopsis> entry : sketch.getTypeSynopses().entrySet()) {
      gen.writeFieldName(entry.getKey().toString());
      writeSynopsis(gen, entry.getValue());
    }
    gen.writeEndObject();
    gen.writeEndObject();
  }

  private static void writeSynopsis(JsonGenerator gen, Synopsis synopsis) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("kind", synopsis.getKind().getName());
    gen.writeStringField("type", synopsis.getType().toString());
    switch (synopsis.getKind()) {
      case BLOOM_FILTER:
        BloomFilterSynopsis bloom = (BloomFilterSynopsis) synopsis;
        BlockedBloomFilter filter = bloom.getFilter();
        gen.writeNumberField("n", bloom.getN());
        gen.writeNumberField("p", bloom.getP());
        gen.writeNumberField("numBlocks", filter.numBlocks());
        gen.writeNumberField("numHashFunctions", filter.numHashFunctions());
        gen.writeStringField("payload", encodeWords(filter.toWords()));
        break;
      case MIN_MAX:
        MinMaxSynopsis<?> minMax = (MinMaxSynopsis<?>) synopsis;
        gen.writeFieldName("min");
        writeBound(gen, minMax.getMin());
        gen.writeFieldName("max");
        writeBound(gen, minMax.getMax());
        break;
      default:
        throw new IllegalStateException("Unknown synopsis kind: " + synopsis.getKind());
    }
    gen.writeEndObject();
  }

  private static void writeBound(JsonGenerator gen, Object bound) throws IOException {
    if (bound instanceof Long) {
      gen.writeNumber((Long) bound);
    } else if (bound instanceof Double) {
      gen.writeString(Double.toString((Double) bound));
    } else if (bound instanceof Boolean) {
      gen.writeBoolean((Boolean) bound);
    } else {
      throw new IllegalStateException("Unsupported bound " + bound);
    }
  }

  private static String encodeWords(long[] words) {
    ByteBuffer buffer =
        ByteBuffer.allocate(words.length * Long.BYTES).order(ByteOrder.LITTLE_ENDIAN);
    buffer.asLongBuffer().put(words);
    return Base64.getEncoder().encodeToString(buffer.array());
  }

  ////////////
  // Reader //
  ////////////

  private static PartitionSketch readSketch(UUID partitionId, JsonNode root) {
    int version = required(root, "version").intValue();
    if (version != VERSION) {
      throw SieveErrors.unsupportedSketchVersion(partitionId, version, VERSION);
    }
    UUID actualId = UUID.fromString(requiredText(root, "partitionId"));
    if (!actualId.equals(partitionId)) {
      throw SieveErrors.partitionIdMismatch(partitionId, actualId);
    }
    PartitionInfo info =
        new PartitionInfo(
            actualId,
            requiredText(root, "schemaName"),
            requiredLong(root, "events"),
            requiredLong(root, "offset"),
            requiredLong(root, "minImportTime"),
            requiredLong(root, "maxImportTime"));

    List<FieldSketch> fields = new ArrayList<>();
    for (JsonNode field : requiredArray(root, "fields")) {
      DataType type = BasePrimitiveType.createPrimitive(requiredText(field, "type"));
      JsonNode synopsis = field.get("synopsis");
      fields.add(
          new FieldSketch(
              requiredText(field, "name"),
              type,
              synopsis == null || synopsis.isNull()
                  ? Optional.<Synopsis>empty()
                  : Optional.of(readSynopsis(synopsis, type))));
    }

    Map<DataType, Synopsis> typeSynopses = new LinkedHashMap<>();
    JsonNode typeNode = required(root, "typeSynopses");
    Iterator<Map.Entry<String, JsonNode>> it = typeNode.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> entry = it.next();
      DataType type = BasePrimitiveType.createPrimitive(entry.getKey());
      typeSynopses.put(type, readSynopsis(entry.getValue(), type));
    }
    return new PartitionSketch(info, fields, typeSynopses);
  }

  private static Synopsis readSynopsis(JsonNode node, DataType expectedType) {
    DataType type = BasePrimitiveType.createPrimitive(requiredText(node, "type"));
    if (!type.equals(expectedType)) {
      throw new IllegalArgumentException(
          String.format("synopsis of type %s on a %s field", type, expectedType));
    }
    SynopsisKind kind = SynopsisKind.fromName(requiredText(node, "kind"));
    switch (kind) {
      case BLOOM_FILTER:
        long[] words = decodeWords(requiredText(node, "payload"));
        int numBlocks = required(node, "numBlocks").intValue();
        if (words.length != numBlocks * BlockedBloomFilter.WORDS_PER_BLOCK) {
          throw new IllegalArgumentException(
              String.format(
                  "Bloom filter payload has %s words, expected %s blocks",
                  words.length,
                  numBlocks));
        }
        BlockedBloomFilter filter =
            BlockedBloomFilter.fromWords(words, required(node, "numHashFunctions").intValue());
        return BloomFilterSynopsis.restore(
            type, requiredLong(node, "n"), required(node, "p").doubleValue(), filter);
      case MIN_MAX:
        return MinMaxSynopsis.restore(
            type, readBound(required(node, "min"), type), readBound(required(node, "max"), type));
      default:
        throw new IllegalArgumentException("Unknown synopsis kind: " + kind);
    }
  }

  private static Object readBound(JsonNode node, DataType type) {
    if (type instanceof LongType || type instanceof TimestampType) {
      checkNode(node.isIntegralNumber(), "integral bound", node);
      return node.longValue();
    } else if (type instanceof DoubleType) {
      checkNode(node.isTextual(), "textual double bound", node);
      return Double.parseDouble(node.textValue());
    } else if (type instanceof BooleanType) {
      checkNode(node.isBoolean(), "boolean bound", node);
      return node.booleanValue();
    }
    throw new IllegalArgumentException("No min-max synopsis for type " + type);
  }

  private static long[] decodeWords(String payload) {
    byte[] bytes = Base64.getDecoder().decode(payload);
    if (bytes.length % Long.BYTES != 0) {
      throw new IllegalArgumentException("Bloom filter payload is not a sequence of words");
    }
    long[] words = new long[bytes.length / Long.BYTES];
    ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN).asLongBuffer().get(words);
    return words;
  }

  private static JsonNode required(JsonNode node, String name) {
    JsonNode child = node.get(name);
    if (child == null || child.isNull()) {
      throw new IllegalArgumentException("missing field '" + name + "'");
    }
    return child;
  }

  private static String requiredText(JsonNode node, String name) {
    JsonNode child = required(node, name);
    checkNode(child.isTextual(), "text for '" + name + "'", child);
    return child.textValue();
  }

  private static long requiredLong(JsonNode node, String name) {
    JsonNode child = required(node, name);
    checkNode(child.isIntegralNumber(), "integer for '" + name + "'", child);
    return child.longValue();
  }

  private static JsonNode requiredArray(JsonNode node, String name) {
    JsonNode child = required(node, name);
    checkNode(child.isArray(), "array for '" + name + "'", child);
    return child;
  }

  private static void checkNode(boolean valid, String expected, JsonNode actual) {
    if (!valid) {
      throw new IllegalArgumentException("expected " + expected + ", got " + actual);
    }
  }
}
