package com.rsfleet.repairs.api;

import com.rsfleet.repairs.api.dto.AssignmentRequest;
import com.rsfleet.repairs.api.dto.BatchResponse;
import com.rsfleet.repairs.api.dto.RepairResponse;
import com.rsfleet.repairs.api.dto.ResolutionRequest;
import com.rsfleet.repairs.event.RepairEventPublisher;
import com.rsfleet.repairs.lifecycle.Actor;
import com.rsfleet.repairs.lifecycle.ActorKind;
import com.rsfleet.repairs.lifecycle.RepairStatusMachine;
import com.rsfleet.repairs.lifecycle.StatusChange;
import com.rsfleet.repairs.pricing.PriceQuote;
import com.rsfleet.repairs.pricing.PricingEngine;
import com.rsfleet.repairs.pricing.PricingInfo;
import com.rsfleet.repairs.pricing.PricingPreview;
import com.rsfleet.repairs.service.BatchCoordinator;
import com.rsfleet.repairs.service.BatchResult;
import com.rsfleet.repairs.service.command.AssignRequestedRepair;
import com.rsfleet.repairs.service.command.CreateBatchRequest;
import com.rsfleet.repairs.service.command.CreateSingleRepairRequest;
import com.rsfleet.repairs.service.command.ResolvePendingRepair;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API for repair creation, pricing and the repair lifecycle.
 *
 * POST /repairs                   create one repair (field or customer request)
 * POST /repairs/batches           create every break of a batch, or none
 * GET  /repairs/pricing/preview   price a batch without creating it
 * GET  /repairs/pricing/next      price of a unit's next repair
 * GET  /repairs/pricing/info      a customer's effective price list and volume discount
 * GET  /repairs                   repairs visible to the actor
 * GET  /repairs/{id}              one repair, 404 when hidden from the actor
 * POST /repairs/{id}/resolution   customer approves or denies a PENDING repair
 * POST /repairs/{id}/assignment   manager assigns a REQUESTED repair
 * POST /repairs/{id}/start        APPROVED → IN_PROGRESS
 * POST /repairs/{id}/complete     IN_PROGRESS → COMPLETED
 *
 * The acting identity comes from the X-Actor-Kind and X-Actor-Id headers set
 * by the authentication layer in front of this service. Events are published
 * here, after the service call has committed.
 */
@RestController
@RequestMapping("/repairs")
public class RepairController {

    static final String ACTOR_KIND = "X-Actor-Kind";
    static final String ACTOR_ID   = "X-Actor-Id";

    private final BatchCoordinator     batchCoordinator;
    private final RepairStatusMachine  statusMachine;
    private final PricingEngine        pricingEngine;
    private final RepairEventPublisher events;

    public RepairController(BatchCoordinator batchCoordinator,
                            RepairStatusMachine statusMachine,
                            PricingEngine pricingEngine,
                            RepairEventPublisher events) {
        this.batchCoordinator = batchCoordinator;
        this.statusMachine    = statusMachine;
        this.pricingEngine    = pricingEngine;
        this.events           = events;
    }

    // ------------------------------------------------------------------
    // Creation
    // ------------------------------------------------------------------

    /**
     * Example:
     *   curl -X POST http://localhost:8080/repairs \
     *     -H "Content-Type: application/json" \
     *     -d '{"customerId":"...","technicianId":"...","unitNumber":"T-104","damageType":"bullseye"}'
     */
    @PostMapping
    public ResponseEntity<RepairResponse> create(@RequestBody CreateSingleRepairRequest req) {
        BatchResult result = batchCoordinator.createSingle(req);
        events.publish(result.event());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(RepairResponse.from(result.repairs().get(0)));
    }

    @PostMapping("/batches")
    public ResponseEntity<BatchResponse> createBatch(@RequestBody CreateBatchRequest req) {
        BatchResult result = batchCoordinator.createBatch(req);
        events.publish(result.event());
        return ResponseEntity.status(HttpStatus.CREATED).body(BatchResponse.from(result));
    }

    // ------------------------------------------------------------------
    // Pricing
    // ------------------------------------------------------------------

    @GetMapping("/pricing/preview")
    public PricingPreview preview(@RequestParam UUID customerId,
                                  @RequestParam String unitNumber,
                                  @RequestParam int breaks) {
        return pricingEngine.preview(customerId, unitNumber.strip(), breaks);
    }

    @GetMapping("/pricing/next")
    public PriceQuote nextPrice(@RequestParam UUID customerId, @RequestParam String unitNumber) {
        return pricingEngine.expectedNextPrice(customerId, unitNumber.strip());
    }

    @GetMapping("/pricing/info")
    public PricingInfo pricingInfo(@RequestParam UUID customerId) {
        return pricingEngine.pricingInfo(customerId);
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    @GetMapping
    public List<RepairResponse> list(@RequestHeader(ACTOR_KIND) ActorKind kind,
                                     @RequestHeader(ACTOR_ID) UUID actorId,
                                     @RequestParam(required = false) UUID customerId) {
        return statusMachine.visibleRepairs(new Actor(kind, actorId), customerId).stream()
                .map(RepairResponse::from)
                .toList();
    }

    @GetMapping("/{id}")
    public RepairResponse get(@PathVariable UUID id,
                              @RequestHeader(ACTOR_KIND) ActorKind kind,
                              @RequestHeader(ACTOR_ID) UUID actorId) {
        return RepairResponse.from(statusMachine.findVisible(id, new Actor(kind, actorId)));
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    @PostMapping("/{id}/resolution")
    public RepairResponse resolve(@PathVariable UUID id,
                                  @RequestHeader(ACTOR_KIND) ActorKind kind,
                                  @RequestHeader(ACTOR_ID) UUID actorId,
                                  @RequestBody ResolutionRequest body) {
        StatusChange change = statusMachine.resolvePending(
                new ResolvePendingRepair(id, body.approved(), body.decidedBy(), body.notes()),
                new Actor(kind, actorId));
        return published(change);
    }

    @PostMapping("/{id}/assignment")
    public RepairResponse assign(@PathVariable UUID id,
                                 @RequestHeader(ACTOR_ID) UUID managerId,
                                 @RequestBody AssignmentRequest body) {
        StatusChange change = statusMachine.assignRequested(
                new AssignRequestedRepair(id, body.technicianId(), managerId));
        return published(change);
    }

    @PostMapping("/{id}/start")
    public RepairResponse start(@PathVariable UUID id, @RequestHeader(ACTOR_ID) UUID technicianId) {
        return published(statusMachine.startWork(id, technicianId));
    }

    @PostMapping("/{id}/complete")
    public RepairResponse complete(@PathVariable UUID id, @RequestHeader(ACTOR_ID) UUID technicianId) {
        return published(statusMachine.complete(id, technicianId));
    }

    private RepairResponse published(StatusChange change) {
        events.publish(change.event());
        return RepairResponse.from(change.repair());
    }
}
