/*
 * どこで: Orderly API
 * 何を: Location の作成/一覧/取得/削除とコード参照 URL のエンドポイントを公開する
 * なぜ: 運用者が窓口を登録し、掲示用コードを取得する入口を提供するため
 */
package com.example.orderly.api;

import com.example.orderly.api.request.CreateLocationRequest;
import com.example.orderly.api.response.CodeReferenceResponse;
import com.example.orderly.api.response.LocationResponse;
import com.example.orderly.api.response.LocationsResponse;
import com.example.orderly.model.Location;
import com.example.orderly.service.CodeReferenceBuilder;
import com.example.orderly.service.LocationRegistryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/locations")
@RequiredArgsConstructor
public class LocationController {

  private static final String HEADER_OPERATOR_ID = "X-Operator-Id";

  private final LocationRegistryService locationRegistry;
  private final CodeReferenceBuilder codeReferenceBuilder;
  private final RequestDeadlines requestDeadlines;

  @PostMapping
  public ResponseEntity<LocationResponse> createLocation(
      @RequestHeader(value = HEADER_OPERATOR_ID, required = false) String operatorId,
      @Valid @RequestBody CreateLocationRequest request) {
    final Location location =
        locationRegistry.createLocation(
            request.name(),
            request.description(),
            request.capacity() == null ? 0 : request.capacity(),
            operatorId);
    return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(location));
  }

  @GetMapping
  public ResponseEntity<LocationsResponse> listLocations() {
    return ResponseEntity.ok(
        new LocationsResponse(
            locationRegistry.listLocations().stream().map(this::toResponse).toList()));
  }

  @GetMapping("/{location_id}")
  public ResponseEntity<LocationResponse> getLocation(
      @PathVariable("location_id") String locationId) {
    return ResponseEntity.ok(toResponse(locationRegistry.getLocation(locationId)));
  }

  @DeleteMapping("/{location_id}")
  public ResponseEntity<Void> deleteLocation(
      @PathVariable("location_id") String locationId,
      @RequestHeader(value = RequestDeadlines.HEADER_TIMEOUT_MS, required = false)
          String timeoutMillis) {
    locationRegistry.deleteLocation(locationId, requestDeadlines.resolve(timeoutMillis));
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/{location_id}/reference")
  public ResponseEntity<CodeReferenceResponse> getReference(
      @PathVariable("location_id") String locationId) {
    final Location location = locationRegistry.getLocation(locationId);
    return ResponseEntity.ok(references(location.locationId()));
  }

  private LocationResponse toResponse(Location location) {
    return LocationResponse.from(location, references(location.locationId()));
  }

  private CodeReferenceResponse references(String locationId) {
    return new CodeReferenceResponse(
        locationId,
        codeReferenceBuilder.buildReference(locationId),
        codeReferenceBuilder.buildStatusReference(locationId));
  }
}
