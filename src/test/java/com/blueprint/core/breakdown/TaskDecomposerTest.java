package com.blueprint.core.breakdown;

import com.blueprint.core.error.GenerationException;
import com.blueprint.core.generation.ContentGenerator;
import com.blueprint.core.generation.TaskDraft;
import com.blueprint.core.metrics.BlueprintMetrics;
import com.blueprint.core.model.IdeaAnalysis;
import com.blueprint.core.model.Task;
import com.blueprint.core.model.TaskDecomposition;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static com.blueprint.core.breakdown.BreakdownFixtures.analysis;
import static com.blueprint.core.breakdown.BreakdownFixtures.deliverable;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TaskDecomposerTest {

    private ContentGenerator generator;
    private SimpleMeterRegistry registry;
    private TaskDecomposer decomposer;

    @BeforeEach
    void setUp() {
        generator = mock(ContentGenerator.class);
        registry = new SimpleMeterRegistry();
        decomposer = new TaskDecomposer(generator, new BreakdownProperties(), new BlueprintMetrics(registry));
    }

    private static TaskDraft draft(String id, String title, Double hours, String... dependencies) {
        return new TaskDraft(id, title, title + " details", hours, 4, List.of("Java"), List.of(dependencies));
    }

    @Test
    @DisplayName("numbers tasks globally in deliverable order and resolves local references")
    void assignsIdsAndResolvesReferences() {
        var backend = deliverable("Backend", 1, 20);
        var frontend = deliverable("Frontend", 2, 10, "Backend");
        when(generator.generateTasks(backend)).thenReturn(List.of(
                draft("a", "Schema", 8.0),
                draft("b", "API", 12.0, "a")));
        when(generator.generateTasks(frontend)).thenReturn(List.of(
                draft("a", "Screens", 6.0, "API"),
                draft("b", "Wiring", 4.0, "a", "t_2")));

        TaskDecomposition result = decomposer.decompose(analysis(backend, frontend));

        List<Task> tasks = result.tasks();
        assertEquals(List.of("t_1", "t_2", "t_3", "t_4"), tasks.stream().map(Task::id).toList());
        assertEquals(List.of("t_1"), tasks.get(1).dependencies());
        assertEquals(List.of("t_2"), tasks.get(2).dependencies());
        assertEquals(List.of("t_3", "t_2"), tasks.get(3).dependencies());
        assertEquals("Frontend", tasks.get(2).deliverableId());
        assertEquals(30.0, result.totalEstimatedHours());
    }

    @Test
    @DisplayName("scales the analysis confidence by the task multiplier")
    void confidence() {
        var d = deliverable("Core", 1, 10);
        when(generator.generateTasks(d)).thenReturn(List.of(draft("a", "Build", 10.0)));

        TaskDecomposition result = decomposer.decompose(analysis(d));

        assertEquals(0.72, result.confidence(), 1e-9);
    }

    @Test
    @DisplayName("falls back to a single task when the generator returns none")
    void emptyDraftList() {
        var d = deliverable("Docs", 1, 6);
        when(generator.generateTasks(d)).thenReturn(List.of());

        Task task = decomposer.decompose(analysis(d)).tasks().get(0);

        assertEquals("t_1", task.id());
        assertEquals("Complete Docs", task.title());
        assertEquals(6.0, task.estimatedHours());
        assertEquals(5, task.complexity());
        assertEquals(List.of("General"), task.requiredSkills());
        assertEquals("Docs", task.deliverableId());
    }

    @Test
    @DisplayName("spreads the unclaimed deliverable hours over tasks without an estimate")
    void missingEstimates() {
        var d = deliverable("Core", 1, 20);
        when(generator.generateTasks(d)).thenReturn(List.of(
                draft("a", "One", 8.0),
                draft("b", "Two", null),
                draft("c", "Three", -1.0)));

        List<Task> tasks = decomposer.decompose(analysis(d)).tasks();

        assertEquals(8.0, tasks.get(0).estimatedHours());
        assertEquals(6.0, tasks.get(1).estimatedHours());
        assertEquals(6.0, tasks.get(2).estimatedHours());
    }

    @Test
    @DisplayName("splits the deliverable evenly when the estimates already exceed it")
    void overclaimedEstimates() {
        var d = deliverable("Core", 1, 9);
        when(generator.generateTasks(d)).thenReturn(List.of(
                draft("a", "One", 12.0),
                draft("b", "Two", null),
                draft("c", "Three", null)));

        List<Task> tasks = decomposer.decompose(analysis(d)).tasks();

        assertEquals(3.0, tasks.get(1).estimatedHours());
        assertEquals(3.0, tasks.get(2).estimatedHours());
    }

    @Test
    @DisplayName("clamps complexity and defaults blank skills")
    void normalizesFields() {
        var d = deliverable("Core", 1, 10);
        when(generator.generateTasks(d)).thenReturn(List.of(
                new TaskDraft(null, "One", null, 5.0, 42, List.of(" ", "SQL", "SQL"), null),
                new TaskDraft(null, "Two", null, 5.0, null, null, null)));

        List<Task> tasks = decomposer.decompose(analysis(d)).tasks();

        assertEquals(10, tasks.get(0).complexity());
        assertEquals(List.of("SQL"), tasks.get(0).requiredSkills());
        assertEquals(5, tasks.get(1).complexity());
        assertEquals(List.of("General"), tasks.get(1).requiredSkills());
        assertEquals("", tasks.get(1).description());
    }

    @Test
    @DisplayName("drops self, dangling and repeated references and counts them")
    void repairsDependencies() {
        var d = deliverable("Core", 1, 10);
        when(generator.generateTasks(d)).thenReturn(List.of(
                draft("a", "One", 5.0, "a", "ghost"),
                draft("b", "Two", 5.0, "a", "One", "t_9")));

        List<Task> tasks = decomposer.decompose(analysis(d)).tasks();

        assertEquals(List.of(), tasks.get(0).dependencies());
        assertEquals(List.of("t_1"), tasks.get(1).dependencies());
        assertEquals(4.0, registry.get("blueprint.tasks.repaired_dependencies").counter().count());

        Set<String> ids = tasks.stream().map(Task::id).collect(Collectors.toSet());
        tasks.forEach(t -> assertTrue(ids.containsAll(t.dependencies())));
    }

    @Test
    @DisplayName("rejects a task without a title")
    void blankTitle() {
        var d = deliverable("Core", 1, 10);
        when(generator.generateTasks(d)).thenReturn(List.of(draft("a", " ", 5.0)));

        var e = assertThrows(GenerationException.class, () -> decomposer.decompose(analysis(d)));
        assertEquals("decompose-tasks", e.operation());
    }

    @Test
    @DisplayName("rejects a missing task list")
    void nullDrafts() {
        IdeaAnalysis.Deliverable d = deliverable("Core", 1, 10);
        when(generator.generateTasks(d)).thenReturn(null);

        assertThrows(GenerationException.class, () -> decomposer.decompose(analysis(d)));
    }
}
