package io.intellixity.pleco.query;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static io.intellixity.pleco.query.Filters.*;
import static org.junit.jupiter.api.Assertions.*;

final class ListQueryJsonTest {
  private static final ObjectMapper JSON = new ObjectMapper();

  @Test
  void parsesFilterSortAndPage() throws Exception {
    String s = """
        {
          "filter": { "make": "Nissan", "OR": [ { "model": "Sentra" }, { "year": 2015 } ] },
          "sort": { "year": "desc" },
          "page": { "limit": 10, "offset": 20 }
        }
        """;
    ListQuery q = JSON.readValue(s, ListQuery.class);
    assertEquals(and(field("make", eq("Nissan")), or(field("model", eq("Sentra")), field("year", eq(2015)))), q.filter());
    assertEquals(SortField.desc("year"), q.sort());
    assertEquals(LimitOffsetPage.of(10, 20), q.page());
  }

  @Test
  void missingPartsStayAbsent() throws Exception {
    ListQuery q = JSON.readValue("{ \"filter\": {} }", ListQuery.class);
    assertNull(q.filter());
    assertNull(q.sort());
    assertNull(q.page());
  }

  @Test
  void writesExplicitForm() throws Exception {
    ListQuery q = ListQuery.of(field("year", in(java.util.List.of(2014, 2015))))
        .withSort(SortField.asc("model"))
        .withPage(LimitOffsetPage.limit(5));

    JsonNode n = JSON.readTree(JSON.writeValueAsString(q));
    assertEquals(2015, n.at("/filter/year/in/1").intValue());
    assertEquals("ASC", n.at("/sort/model").asText());
    assertEquals(5, n.at("/page/limit").intValue());
    assertTrue(n.at("/page/offset").isMissingNode());

    ListQuery back = JSON.readValue(JSON.writeValueAsString(q), ListQuery.class);
    assertEquals(q.filter(), back.filter());
  }

  @Test
  void rejectsNonObjectFilter() {
    assertThrows(Exception.class, () -> JSON.readValue("{ \"filter\": [1] }", ListQuery.class));
  }

  @Test
  void rejectsPageBoundsOutsideIntRange() {
    JsonMappingException e = assertThrows(JsonMappingException.class,
        () -> JSON.readValue("{ \"page\": { \"limit\": 4294967301, \"offset\": 0 } }", ListQuery.class));
    assertTrue(e.getMessage().contains("page.limit"), e.getMessage());

    e = assertThrows(JsonMappingException.class,
        () -> JSON.readValue("{ \"page\": { \"offset\": 4294967296 } }", ListQuery.class));
    assertTrue(e.getMessage().contains("page.offset"), e.getMessage());
  }

  @Test
  void rejectsFractionalPageBounds() {
    JsonMappingException e = assertThrows(JsonMappingException.class,
        () -> JSON.readValue("{ \"page\": { \"limit\": 2.5 } }", ListQuery.class));
    assertTrue(e.getMessage().contains("page.limit"), e.getMessage());
  }

  @Test
  void jsonAndMapInputAgree() throws Exception {
    String s = "{ \"sort\": { \"year\": \"DESC\" }, \"page\": { \"limit\": 3.0 } }";
    ListQuery fromJson = JSON.readValue(s, ListQuery.class);
    ListQuery fromMap = ListQuery.fromMap(JSON.readValue(s, new TypeReference<Map<String, Object>>() {}));
    assertEquals(fromMap.sort(), fromJson.sort());
    assertEquals(fromMap.page(), fromJson.page());
    assertEquals(LimitOffsetPage.limit(3), fromJson.page());

    Map<String, Object> nullDirection = new HashMap<>();
    nullDirection.put("year", null);
    assertThrows(IllegalArgumentException.class, () -> ListQuery.fromMap(Map.of("sort", nullDirection)));
    assertThrows(JsonMappingException.class,
        () -> JSON.readValue("{ \"sort\": { \"year\": null } }", ListQuery.class));
  }
}
