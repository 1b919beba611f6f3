package io.intellixity.pleco.examples.web;

import io.intellixity.pleco.examples.service.VehicleSearchService;
import io.intellixity.pleco.schema.GraphQLFilterTypes;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/vehicles")
public final class VehicleController {
  private final VehicleSearchService vehicles;

  public VehicleController(VehicleSearchService vehicles) {
    this.vehicles = vehicles;
  }

  @PostMapping(value = "/search", consumes = MediaType.APPLICATION_JSON_VALUE)
  public List<Map<String, Object>> search(@RequestBody(required = false) Map<String, Object> request) {
    return vehicles.search(request);
  }

  @PostMapping("/count")
  public long count(@RequestBody(required = false) Map<String, Object> request) {
    return vehicles.count(request);
  }

  /** Filter, sort and page input types as GraphQL SDL. */
  @GetMapping(value = "/schema", produces = MediaType.TEXT_PLAIN_VALUE)
  public String schema() {
    return GraphQLFilterTypes.sdl();
  }
}
