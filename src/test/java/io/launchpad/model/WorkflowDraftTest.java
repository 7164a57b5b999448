package io.launchpad.model;

import io.launchpad.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

final class WorkflowDraftTest {

    @Test
    void rejectsCycles() {
        List<Firework> fws = List.of(node(1L), node(2L), node(3L));
        IllegalArgumentException e = Assertions.assertThrows(IllegalArgumentException.class,
                () -> new WorkflowDraft("loop", null, fws, Map.of(1L, List.of(2L), 2L, List.of(3L), 3L, List.of(1L))));
        Assertions.assertTrue(e.getMessage().contains("Circular dependency"));
    }

    @Test
    void rejectsUnknownIdsSelfLinksAndDuplicates() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new WorkflowDraft("x", null, List.of(node(1L)), Map.of(1L, List.of(9L))));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new WorkflowDraft("x", null, List.of(node(1L)), Map.of(1L, List.of(1L))));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new WorkflowDraft("x", null, List.of(node(1L), node(1L)), Map.of()));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new WorkflowDraft("x", null, List.of(), Map.of()));
    }

    @Test
    void parsesJsonWithImplicitIdsAndFindsRootsAndLeaves() {
        String json = """
                {
                  "name": "pipeline",
                  "metadata": {"project": "demo"},
                  "fireworks": [
                    {"fw_id": 10, "name": "fetch", "spec": {"url": "x"}, "tasks": [{"_task": "echo"}]},
                    {"fw_id": 20, "name": "parse"},
                    {"name": "report"}
                  ],
                  "links": {"10": [20], "20": [-1]}
                }
                """;
        WorkflowDraft draft = WorkflowDraft.fromJson(Jsons.readTree(json));

        Assertions.assertEquals("pipeline", draft.name());
        Assertions.assertEquals("demo", draft.metadata().path("project").asText());
        Assertions.assertEquals(List.of(10L), draft.roots());
        Assertions.assertEquals(List.of(-1L), draft.leaves());
        Assertions.assertEquals("echo", draft.fireworks().get(0).tasks().get(0).path("_task").asText());

        WorkflowDraft again = WorkflowDraft.fromJson(draft.toJson());
        Assertions.assertEquals(draft.links(), again.links());
    }

    @Test
    void implicitIdsStayBelowExplicitNegativeIds() {
        String json = """
                {
                  "fireworks": [
                    {"name": "first"},
                    {"fw_id": -2, "name": "second"},
                    {"name": "third"}
                  ],
                  "links": {"-2": [-3]}
                }
                """;
        WorkflowDraft draft = WorkflowDraft.fromJson(Jsons.readTree(json));

        Assertions.assertEquals(List.of(-3L, -2L, -4L),
                draft.fireworks().stream().map(Firework::fwId).toList());
        Assertions.assertEquals(List.of(-3L), draft.links().get(-2L));
    }

    @Test
    void duplicateLinksCollapse() {
        WorkflowDraft draft = new WorkflowDraft("dup", null, List.of(node(1L), node(2L)), Map.of(1L, List.of(2L, 2L)));
        Assertions.assertEquals(List.of(2L), draft.links().get(1L));
    }

    private static Firework node(long id) {
        return Firework.draft(id, "fw" + id, List.of(), null);
    }
}
