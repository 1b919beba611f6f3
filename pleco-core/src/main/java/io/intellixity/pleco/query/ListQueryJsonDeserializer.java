package io.intellixity.pleco.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.*;

import java.io.IOException;
import java.util.Map;

/**
 * JSON deserializer for {@link ListQuery}:
 * <pre>
 * { "filter": {...}, "sort": { "year": "DESC" }, "page": { "limit": 10, "offset": 20 } }
 * </pre>
 * The body is read as plain maps and handed to {@link ListQuery#fromMap}. Bad sort or page input is reported
 * as a {@link JsonMappingException}.
 */
public final class ListQueryJsonDeserializer extends JsonDeserializer<ListQuery> {
  @Override
  @SuppressWarnings("unchecked")
  public ListQuery deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new MalformedFilterException("List query JSON must be an object");

    Map<String, Object> request = codec.treeToValue(root, Map.class);
    try {
      return ListQuery.fromMap(request);
    } catch (IllegalArgumentException e) {
      throw JsonMappingException.from(p, e.getMessage(), e);
    }
  }
}
