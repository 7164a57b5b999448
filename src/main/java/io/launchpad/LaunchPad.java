package io.launchpad;

import io.launchpad.config.LaunchPadConfig;
import io.launchpad.config.LaunchPadSettings;
import io.launchpad.engine.CheckoutCoordinator;
import io.launchpad.engine.CheckoutResult;
import io.launchpad.engine.CompletionHandler;
import io.launchpad.engine.LaunchMaintenance;
import io.launchpad.engine.OperatorActions;
import io.launchpad.engine.RefreshEngine;
import io.launchpad.engine.SelectionPolicy;
import io.launchpad.engine.WorkflowInserter;
import io.launchpad.engine.WorkflowSnapshot;
import io.launchpad.exceptions.LaunchPadException;
import io.launchpad.exceptions.NotFoundException;
import io.launchpad.model.Firework;
import io.launchpad.model.FireworkState;
import io.launchpad.model.FwAction;
import io.launchpad.model.Launch;
import io.launchpad.model.WorkflowDraft;
import io.launchpad.model.WorkflowSummary;
import io.launchpad.model.WorkflowView;
import io.launchpad.observability.AuditLogger;
import io.launchpad.observability.AuditLogger.AuditEvent;
import io.launchpad.storage.Database;
import io.launchpad.storage.DocumentStore;
import io.launchpad.storage.IdAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Entry point to one store instance. Every operation re-reads what it needs
 * inside its own transaction; nothing is cached between calls, so several
 * instances (or processes) may share one data root.
 */
public final class LaunchPad {
    private static final Logger log = LoggerFactory.getLogger(LaunchPad.class);
    private static final String OPERATOR = "operator";

    private final LaunchPadConfig config;
    private final LaunchPadSettings settings;
    private final Clock clock;
    private final String host;
    private final Database database;
    private final DocumentStore store;
    private final IdAllocator allocator;
    private final WorkflowInserter inserter;
    private final RefreshEngine refreshEngine;
    private final CheckoutCoordinator checkoutCoordinator;
    private final CompletionHandler completionHandler;
    private final OperatorActions operatorActions;
    private final LaunchMaintenance maintenance;
    private final AuditLogger audit;

    public LaunchPad(LaunchPadConfig config, LaunchPadSettings settings, Clock clock) {
        this.config = config;
        this.settings = settings;
        this.clock = clock;
        this.host = resolveHost();
        this.database = new Database(config, settings);
        this.database.init();
        this.store = new DocumentStore();
        this.allocator = new IdAllocator(database);
        this.inserter = new WorkflowInserter(store, allocator);
        this.refreshEngine = new RefreshEngine(store);
        this.checkoutCoordinator = new CheckoutCoordinator(database, store, allocator, refreshEngine,
                settings.maxClaimAttempts(), SelectionPolicy.LOWEST_ID.order());
        this.completionHandler = new CompletionHandler(database, store, inserter, refreshEngine);
        this.operatorActions = new OperatorActions(database, store, refreshEngine);
        this.maintenance = new LaunchMaintenance(database, store, refreshEngine);
        this.audit = new AuditLogger(config.auditFile(), clock);
    }

    public static LaunchPad open(LaunchPadConfig config) {
        return new LaunchPad(config, LaunchPadSettings.load(config), Clock.systemUTC());
    }

    public LaunchPadConfig config() {
        return config;
    }

    public LaunchPadSettings settings() {
        return settings;
    }

    public IdAllocator idAllocator() {
        return allocator;
    }

    public AuditLogger auditLogger() {
        return audit;
    }

    public void setSelectionOrder(Comparator<Firework> order) {
        checkoutCoordinator.setOrder(order);
    }

    /**
     * Wipes every table and puts all counters back to 1. Destructive.
     */
    public void resetStore() {
        database.reset();
        audit.log(AuditEvent.ok("reset", OPERATOR, config.dbFile().toString(), Map.of()));
    }

    public WorkflowInserter.InsertResult submit(WorkflowDraft draft) {
        WorkflowInserter.InsertResult result = database.inTransaction(c -> inserter.submit(c, draft, clock.instant()));
        log.info("Submitted workflow {} '{}' with {} fireworks", result.wfId(), draft.name(), result.idMap().size());
        audit.log(AuditEvent.ok("submit", OPERATOR, "workflow:" + result.wfId(),
                Map.of("fireworks", new ArrayList<>(result.idMap().values()))));
        return result;
    }

    /**
     * Submits each draft in its own transaction, in order.
     */
    public List<WorkflowInserter.InsertResult> bulkSubmit(List<WorkflowDraft> drafts) {
        List<WorkflowInserter.InsertResult> out = new ArrayList<>();
        for (WorkflowDraft draft : drafts) {
            out.add(submit(draft));
        }
        return out;
    }

    public Firework getFirework(long fwId) {
        return database.inTransaction(c -> Firework.fromRecord(
                store.getFirework(c, fwId).orElseThrow(() -> NotFoundException.firework(fwId))));
    }

    public WorkflowView getWorkflowByFirework(long fwId) {
        return database.inTransaction(c -> WorkflowSnapshot.forFirework(store, c, fwId).toView());
    }

    public WorkflowView getWorkflow(long wfId) {
        return database.inTransaction(c -> WorkflowSnapshot.load(store, c, wfId).toView());
    }

    public WorkflowSummary getWorkflowSummary(long fwId) {
        return WorkflowSummary.of(getWorkflowByFirework(fwId));
    }

    public Launch getLaunch(long launchId) {
        return database.inTransaction(c -> Launch.fromRecord(
                store.getLaunch(c, launchId).orElseThrow(() -> NotFoundException.launch(launchId))));
    }

    /**
     * @param state only fireworks in this state, or every firework when null
     */
    public List<Long> getFireworkIds(FireworkState state) {
        return database.inTransaction(c -> store.findFireworkIds(c, state == null ? null : state.name()));
    }

    public List<Long> getWorkflowIds() {
        return database.inTransaction(store::listWorkflowIds);
    }

    public CheckoutResult checkout(String launchDir, Long fwId) {
        return checkout(settings.workerName(), launchDir, fwId);
    }

    public CheckoutResult checkout(String worker, String launchDir, Long fwId) {
        CheckoutResult result = checkoutCoordinator.checkout(worker, host, launchDir, fwId, clock.instant());
        auditClaim("checkout", worker, result);
        return result;
    }

    public CheckoutResult reserve(String worker, String launchDir, Long fwId) {
        CheckoutResult result = checkoutCoordinator.reserve(worker, host, launchDir, fwId, clock.instant());
        auditClaim("reserve", worker, result);
        return result;
    }

    public CheckoutResult startReservation(long launchId) {
        return audited("start_reservation", settings.workerName(), "launch:" + launchId,
                () -> checkoutCoordinator.startReservation(launchId, clock.instant()),
                r -> Map.of("fw_id", r.firework().fwId()));
    }

    public Launch cancelReservation(long launchId) {
        return audited("cancel_reservation", settings.workerName(), "launch:" + launchId,
                () -> checkoutCoordinator.cancelReservation(launchId, clock.instant()),
                l -> Map.of("fw_id", l.fwId()));
    }

    public Launch pingLaunch(long launchId) {
        return maintenance.ping(launchId, clock.instant());
    }

    public CompletionHandler.Completion complete(long launchId, FwAction action, FireworkState finalState) {
        return audited("complete", settings.workerName(), "launch:" + launchId,
                () -> completionHandler.complete(launchId, action, finalState, clock.instant()),
                done -> {
                    Map<String, Object> details = new LinkedHashMap<>();
                    details.put("fw_id", done.launch().fwId());
                    details.put("state", finalState.name());
                    details.put("detours", done.detourIds());
                    details.put("changed", new ArrayList<>(done.changed()));
                    return details;
                });
    }

    /**
     * One refresh step from {@code fwId}; returns the ids it changed.
     */
    public Set<Long> refresh(long fwId) {
        return database.inTransaction(c -> refreshEngine.refresh(c, fwId, clock.instant()));
    }

    public Set<Long> refreshToFixedPoint(long fwId) {
        return database.inTransaction(c -> refreshEngine.refreshToFixedPoint(c, fwId, clock.instant()));
    }

    public WorkflowView pause(long fwId) {
        return operator("pause", fwId, () -> operatorActions.pause(fwId, clock.instant()));
    }

    public WorkflowView resume(long fwId) {
        return operator("resume", fwId, () -> operatorActions.resume(fwId, clock.instant()));
    }

    public WorkflowView defuse(long fwId) {
        return operator("defuse", fwId, () -> operatorActions.defuse(fwId, clock.instant()));
    }

    public WorkflowView reignite(long fwId) {
        return operator("reignite", fwId, () -> operatorActions.reignite(fwId, clock.instant()));
    }

    public WorkflowView rerun(long fwId) {
        return operator("rerun", fwId, () -> operatorActions.rerun(fwId, clock.instant()));
    }

    public WorkflowView setPriority(long fwId, int priority) {
        return operator("set_priority", fwId, () -> operatorActions.setPriority(fwId, priority, clock.instant()));
    }

    public WorkflowView pauseWorkflow(long fwId) {
        return operator("pause_wf", fwId, () -> operatorActions.pauseWorkflow(fwId, clock.instant()));
    }

    public WorkflowView resumeWorkflow(long fwId) {
        return operator("resume_wf", fwId, () -> operatorActions.resumeWorkflow(fwId, clock.instant()));
    }

    public WorkflowView defuseWorkflow(long fwId) {
        return operator("defuse_wf", fwId, () -> operatorActions.defuseWorkflow(fwId, clock.instant()));
    }

    public WorkflowView reigniteWorkflow(long fwId) {
        return operator("reignite_wf", fwId, () -> operatorActions.reigniteWorkflow(fwId, clock.instant()));
    }

    public WorkflowView archiveWorkflow(long fwId) {
        return operator("archive_wf", fwId, () -> operatorActions.archiveWorkflow(fwId, clock.instant()));
    }

    public List<Long> detectLostRuns() {
        return detectLostRuns(settings.lostRunExpiryMs());
    }

    public List<Long> detectLostRuns(long expiryMs) {
        List<Long> reclaimed = maintenance.detectLostRuns(expiryMs, clock.instant());
        if (!reclaimed.isEmpty()) {
            audit.log(AuditEvent.ok("detect_lostruns", OPERATOR, "launches", Map.of("launch_ids", reclaimed)));
        }
        return reclaimed;
    }

    public List<Long> detectUnreserved() {
        return detectUnreserved(settings.reservationExpiryMs());
    }

    public List<Long> detectUnreserved(long expiryMs) {
        List<Long> reclaimed = maintenance.detectUnreserved(expiryMs, clock.instant());
        if (!reclaimed.isEmpty()) {
            audit.log(AuditEvent.ok("detect_unreserved", OPERATOR, "launches", Map.of("launch_ids", reclaimed)));
        }
        return reclaimed;
    }

    private void auditClaim(String action, String worker, CheckoutResult result) {
        if (result.isEmpty()) {
            return;
        }
        audit.log(AuditEvent.ok(action, worker, "firework:" + result.firework().fwId(),
                Map.of("launch_id", result.launch().launchId(), "host", host)));
    }

    private WorkflowView operator(String action, long fwId, Supplier<WorkflowView> op) {
        return audited(action, OPERATOR, "firework:" + fwId, op,
                view -> Map.of("wf_id", view.workflow().wfId(), "wf_state", view.state().name()));
    }

    private <T> T audited(String action, String actor, String resource, Supplier<T> op,
                          Function<T, Map<String, Object>> details) {
        try {
            T out = op.get();
            audit.log(AuditEvent.ok(action, actor, resource, details.apply(out)));
            return out;
        } catch (LaunchPadException e) {
            audit.log(AuditEvent.rejected(action, actor, resource, e.getMessage()));
            throw e;
        }
    }

    private static String resolveHost() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.debug("Local host name unavailable, using localhost", e);
            return "localhost";
        }
    }
}
