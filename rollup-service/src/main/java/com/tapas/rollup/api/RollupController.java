package com.tapas.rollup.api;

import com.tapas.rollup.dto.ChildChangeEventPayload;
import com.tapas.rollup.service.RollupDefinitionLookup;
import com.tapas.rollup.service.RollupResult;
import com.tapas.rollup.service.RollupUpdateService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/rollups")
public class RollupController {

    private final RollupUpdateService updateService;
    private final RollupDefinitionLookup definitionLookup;

    public RollupController(RollupUpdateService updateService, RollupDefinitionLookup definitionLookup) {
        this.updateService = updateService;
        this.definitionLookup = definitionLookup;
    }

    @Operation(
            summary = "Recalculate rollups for child records",
            description = "Recomputes every active rollup defined for the given child records, without change detection.",
            responses = {
                    @ApiResponse(
                            responseCode = "200",
                            description = "Merged parent records",
                            content = @Content(
                                    mediaType = "application/json",
                                    schema = @Schema(implementation = RollupResponse.class),
                                    examples = @ExampleObject(
                                            name = "recalculateExample",
                                            value = "{\n  \"contexts\": 1,\n  \"persisted\": false,\n  \"parents\": [{\n    \"type\": \"Account\",\n    \"id\": \"A1\",\n    \"fields\": {\"AnnualRevenue\": 250}\n  }]\n}"
                                    )
                            )
                    ),
                    @ApiResponse(responseCode = "422", description = "A rollup definition is misconfigured")
            }
    )
    @PostMapping("/recalculate")
    public RollupResponse recalculate(
            @RequestBody @Valid RecalculateRequest request,
            @Parameter(description = "Write the merged parent records back", example = "false")
            @RequestParam(defaultValue = "false") boolean persist
    ) {
        var records = request.records().stream()
                .map(r -> r.toChildRecord(request.childType()))
                .toList();
        RollupResult result = updateService.recalculate(records, persist);
        return RollupResponse.from(result, persist);
    }

    @Operation(summary = "Apply a child change event", description = "Same processing as an event read from Kafka.")
    @PostMapping("/changes")
    public ChangeResponse applyChange(
            @RequestBody @Valid ChildChangeEventPayload event,
            @RequestParam(defaultValue = "true") boolean persist
    ) {
        int parents = updateService.applyChanges(List.of(event.toBatch()), persist);
        return new ChangeResponse(parents);
    }

    @Operation(summary = "Active real-time rollup definitions for a child type")
    @GetMapping("/definitions")
    public List<RollupDefinitionResponse> definitions(
            @Parameter(description = "Child entity type", example = "Opportunity")
            @RequestParam String childObject
    ) {
        return definitionLookup.definitionsFor(childObject)
                .stream()
                .map(RollupDefinitionResponse::from)
                .toList();
    }

    public record ChangeResponse(int parentsUpdated) {
    }
}
