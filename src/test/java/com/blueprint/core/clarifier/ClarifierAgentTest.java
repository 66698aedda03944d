package com.blueprint.core.clarifier;

import com.blueprint.core.confidence.ConfidenceCalculator;
import com.blueprint.core.confidence.ConfidenceProperties;
import com.blueprint.core.error.ConflictException;
import com.blueprint.core.error.GenerationException;
import com.blueprint.core.error.NotFoundException;
import com.blueprint.core.error.ValidationException;
import com.blueprint.core.events.BlueprintEvent;
import com.blueprint.core.events.EventBus;
import com.blueprint.core.generation.ContentGenerator;
import com.blueprint.core.generation.QuestionDraft;
import com.blueprint.core.metrics.BlueprintMetrics;
import com.blueprint.core.model.ClarificationSession;
import com.blueprint.core.model.ClarificationStatus;
import com.blueprint.core.model.QuestionType;
import com.blueprint.core.persistence.ClarificationSessionRepository;
import com.blueprint.core.persistence.InMemoryClarificationSessionRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ClarifierAgentTest {

    private static final String IDEA = "A mobile app that helps neighbours share garden tools";

    private ContentGenerator generator;
    private ClarificationSessionRepository repository;
    private SimpleMeterRegistry registry;
    private List<BlueprintEvent> events;
    private ClarifierProperties properties;
    private ClarifierAgent agent;

    @BeforeEach
    void setUp() {
        generator = mock(ContentGenerator.class);
        when(generator.generateQuestions(anyString())).thenReturn(List.of(
                new QuestionDraft("audience", "Who is the target audience?", "open", null, true),
                new QuestionDraft("platform", "Which platforms?", "multiple_choice", List.of("iOS", "Android"), true),
                new QuestionDraft(null, "Any budget limits?", "yes_no", null, false)));
        when(generator.refineIdea(any())).thenReturn("Refined: garden tool sharing app for iOS and Android");

        repository = new InMemoryClarificationSessionRepository();
        registry = new SimpleMeterRegistry();
        events = new ArrayList<>();
        properties = new ClarifierProperties();

        agent = newAgent(repository);
    }

    private ClarifierAgent newAgent(ClarificationSessionRepository repo) {
        return new ClarifierAgent(generator, repo, new ConfidenceCalculator(new ConfidenceProperties()),
                properties, eventBusCapturing(), new BlueprintMetrics(registry),
                Clock.fixed(Instant.parse("2026-03-02T09:00:00Z"), ZoneOffset.UTC));
    }

    private EventBus eventBusCapturing() {
        var bus = new EventBus();
        bus.subscribeAll(events::add);
        return bus;
    }

    @Nested
    @DisplayName("startClarification")
    class Start {

        @Test
        @DisplayName("creates a CLARIFYING session with the base confidence")
        void createsSession() {
            ClarificationSession session = agent.startClarification("idea-1", IDEA);

            assertEquals(ClarificationStatus.CLARIFYING, session.status());
            assertEquals(3, session.questions().size());
            assertEquals(0.3, session.confidence(), 1e-9);
            assertTrue(session.answers().isEmpty());
            assertEquals(Instant.parse("2026-03-02T09:00:00Z"), session.createdAt());
            assertTrue(repository.get("idea-1").isPresent());
            assertEquals(1.0, registry.find("blueprint.clarifications.started").counter().count());
            assertEquals("clarification.started", events.get(0).eventType());
        }

        @Test
        @DisplayName("maps question drafts and fills blank ids")
        void mapsQuestions() {
            ClarificationSession session = agent.startClarification("idea-1", IDEA);

            assertEquals("audience", session.questions().get(0).id());
            assertEquals(QuestionType.MULTIPLE_CHOICE, session.questions().get(1).type());
            assertEquals(List.of("iOS", "Android"), session.questions().get(1).options());
            assertEquals("q_3", session.questions().get(2).id());
            assertFalse(session.questions().get(2).required());
        }

        @Test
        @DisplayName("returns the existing session without generating questions again")
        void idempotent() {
            ClarificationSession first = agent.startClarification("idea-1", IDEA);
            ClarificationSession second = agent.startClarification("idea-1", IDEA + " (again)");

            assertSame(first, second);
            verify(generator, times(1)).generateQuestions(anyString());
        }

        @Test
        @DisplayName("rejects blank ids and ideas outside the length bounds")
        void validation() {
            assertThrows(ValidationException.class, () -> agent.startClarification(" ", IDEA));
            assertThrows(ValidationException.class, () -> agent.startClarification("idea-1", "too short"));
            assertThrows(ValidationException.class, () -> agent.startClarification("idea-1", "x".repeat(10_001)));
            assertThrows(ValidationException.class, () -> agent.startClarification("i".repeat(101), IDEA));
            verifyNoInteractions(generator);
        }

        @Test
        @DisplayName("fails when the generator returns no questions")
        void noQuestions() {
            when(generator.generateQuestions(anyString())).thenReturn(List.of());

            assertThrows(GenerationException.class, () -> agent.startClarification("idea-1", IDEA));
            assertTrue(repository.get("idea-1").isEmpty());
        }

        @Test
        @DisplayName("fails on duplicate question ids or blank question text")
        void invalidQuestions() {
            when(generator.generateQuestions(anyString())).thenReturn(List.of(
                    new QuestionDraft("a", "First?", "open", null, true),
                    new QuestionDraft("a", "Second?", "open", null, true)));
            assertThrows(GenerationException.class, () -> agent.startClarification("idea-1", IDEA));

            when(generator.generateQuestions(anyString())).thenReturn(List.of(
                    new QuestionDraft("a", "  ", "open", null, true)));
            assertThrows(GenerationException.class, () -> agent.startClarification("idea-1", IDEA));
        }

        @Test
        @DisplayName("drops null and blank options from multiple-choice questions")
        void cleansOptions() {
            when(generator.generateQuestions(anyString())).thenReturn(List.of(
                    new QuestionDraft("platform", "Which platforms?", "multiple_choice",
                            Arrays.asList("iOS", null, " ", " Android ", "iOS"), true)));

            ClarificationSession session = agent.startClarification("idea-1", IDEA);

            assertEquals(List.of("iOS", "Android"), session.questions().get(0).options());
        }

        @Test
        @DisplayName("default ids skip ids the generator already used")
        void defaultIdsAvoidExplicitOnes() {
            when(generator.generateQuestions(anyString())).thenReturn(List.of(
                    new QuestionDraft("q_2", "Who is it for?", "open", null, true),
                    new QuestionDraft(null, "Which platforms?", "open", null, true),
                    new QuestionDraft(" ", "Any budget?", "open", null, true)));

            ClarificationSession session = agent.startClarification("idea-1", IDEA);

            assertEquals(List.of("q_2", "q_3", "q_4"),
                    session.questions().stream().map(q -> q.id()).toList());
        }

        @Test
        @DisplayName("propagates generator failures and stores nothing")
        void generatorFailure() {
            when(generator.generateQuestions(anyString()))
                    .thenThrow(new GenerationException("generate-questions", "model unavailable"));

            assertThrows(GenerationException.class, () -> agent.startClarification("idea-1", IDEA));
            assertEquals(0, repository.count());
        }
    }

    @Nested
    @DisplayName("submitAnswer")
    class Submit {

        @BeforeEach
        void start() {
            agent.startClarification("idea-1", IDEA);
        }

        @Test
        @DisplayName("records the answer and raises confidence")
        void recordsAnswer() {
            ClarificationSession session = agent.submitAnswer("idea-1", "audience", " Hobby gardeners ");

            assertEquals("Hobby gardeners", session.answers().get("audience"));
            assertTrue(session.questions().get(0).answered());
            assertEquals(0.5, session.confidence(), 1e-9);
            assertEquals(ClarificationStatus.CLARIFYING, session.status());
        }

        @Test
        @DisplayName("a duplicate submission leaves the session unchanged")
        void duplicate() {
            ClarificationSession first = agent.submitAnswer("idea-1", "audience", "Hobby gardeners");
            ClarificationSession second = agent.submitAnswer("idea-1", "audience", "Hobby gardeners");

            assertSame(first, second);
            assertEquals(first.confidence(), second.confidence());
            assertEquals(1.0, registry.find("blueprint.clarifications.answers").counter().count());
        }

        @Test
        @DisplayName("overwriting an answer does not change confidence")
        void overwrite() {
            double before = agent.submitAnswer("idea-1", "audience", "Hobby gardeners").confidence();
            ClarificationSession after = agent.submitAnswer("idea-1", "audience", "Allotment owners");

            assertEquals(before, after.confidence(), 1e-9);
            assertEquals("Allotment owners", after.answers().get("audience"));
        }

        @Test
        @DisplayName("answering every question completes the session")
        void completesWhenAllAnswered() {
            agent.submitAnswer("idea-1", "audience", "Hobby gardeners");
            agent.submitAnswer("idea-1", "platform", "Both");
            ClarificationSession session = agent.submitAnswer("idea-1", "q_3", "No");

            assertEquals(ClarificationStatus.COMPLETE, session.status());
            assertEquals(0.9, session.confidence());
            assertEquals(1.0, registry.find("blueprint.clarifications.completed").counter().count());
            assertTrue(events.stream().anyMatch(e -> e.eventType().equals("clarification.completed")));
        }

        @Test
        @DisplayName("a complete session rejects new answers but accepts the stored one")
        void completeIsImmutable() {
            agent.submitAnswer("idea-1", "audience", "Hobby gardeners");
            agent.submitAnswer("idea-1", "platform", "Both");
            ClarificationSession complete = agent.submitAnswer("idea-1", "q_3", "No");

            assertThrows(ValidationException.class, () -> agent.submitAnswer("idea-1", "q_3", "Yes"));
            assertSame(complete, agent.submitAnswer("idea-1", "q_3", "No"));
        }

        @Test
        @DisplayName("parallel answers to one session are all kept")
        void parallelAnswers() throws Exception {
            Map<String, String> answers = Map.of("audience", "Hobby gardeners", "platform", "Both", "q_3", "No");
            ExecutorService pool = Executors.newFixedThreadPool(6);
            var go = new CountDownLatch(1);
            try {
                List<Future<ClarificationSession>> futures = new ArrayList<>();
                for (int round = 0; round < 5; round++) {
                    answers.forEach((questionId, answer) -> futures.add(pool.submit(() -> {
                        go.await(5, TimeUnit.SECONDS);
                        return agent.submitAnswer("idea-1", questionId, answer);
                    })));
                }
                go.countDown();
                for (Future<ClarificationSession> f : futures) {
                    f.get(10, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }

            ClarificationSession stored = agent.getSession("idea-1").orElseThrow();
            assertEquals(answers, stored.answers());
            assertEquals(ClarificationStatus.COMPLETE, stored.status());
            assertEquals(0.9, stored.confidence(), 1e-9);
            assertEquals(3.0, registry.find("blueprint.clarifications.answers").counter().count());
            assertEquals(1.0, registry.find("blueprint.clarifications.completed").counter().count());
        }

        @Test
        @DisplayName("confidence never decreases as answers accumulate")
        void monotone() {
            double c1 = agent.submitAnswer("idea-1", "audience", "a").confidence();
            double c2 = agent.submitAnswer("idea-1", "platform", "b").confidence();
            double c3 = agent.submitAnswer("idea-1", "audience", "c").confidence();
            double c4 = agent.submitAnswer("idea-1", "q_3", "d").confidence();

            assertTrue(c1 <= c2 && c2 <= c3 && c3 <= c4);
        }

        @Test
        @DisplayName("unknown ideas are not found")
        void unknownIdea() {
            assertThrows(NotFoundException.class, () -> agent.submitAnswer("nope", "audience", "x"));
        }

        @Test
        @DisplayName("rejects unknown questions, blank answers and oversized answers")
        void validation() {
            assertThrows(ValidationException.class, () -> agent.submitAnswer("idea-1", "nope", "x"));
            assertThrows(ValidationException.class, () -> agent.submitAnswer("idea-1", "audience", "  "));
            assertThrows(ValidationException.class,
                    () -> agent.submitAnswer("idea-1", "audience", "x".repeat(5001)));
            assertThrows(ValidationException.class, () -> agent.submitAnswer("idea-1", null, "x"));
        }

        @Test
        @DisplayName("raises ConflictException when the stored session changed underneath")
        void conflict() {
            ClarificationSessionRepository racing = spy(new InMemoryClarificationSessionRepository());
            ClarifierAgent racingAgent = newAgent(racing);
            racingAgent.startClarification("idea-2", IDEA);
            doReturn(false).when(racing).replace(any(), any());

            ConflictException e = assertThrows(ConflictException.class,
                    () -> racingAgent.submitAnswer("idea-2", "audience", "x"));
            assertTrue(e.retryable());
        }
    }

    @Nested
    @DisplayName("completeClarification")
    class Complete {

        @BeforeEach
        void start() {
            agent.startClarification("idea-1", IDEA);
        }

        @Test
        @DisplayName("refines the idea once required questions are answered")
        void completes() {
            agent.submitAnswer("idea-1", "audience", "Hobby gardeners");
            agent.submitAnswer("idea-1", "platform", "Both");

            ClarificationSession session = agent.completeClarification("idea-1");

            assertEquals(ClarificationStatus.COMPLETE, session.status());
            assertEquals("Refined: garden tool sharing app for iOS and Android", session.refinedIdea());
            assertEquals(0.9, session.confidence(), 1e-9);
            assertEquals(session, agent.getSession("idea-1").orElseThrow());
        }

        @Test
        @DisplayName("fails while required questions are unanswered")
        void requiresAnswers() {
            agent.submitAnswer("idea-1", "audience", "Hobby gardeners");

            ValidationException e = assertThrows(ValidationException.class,
                    () -> agent.completeClarification("idea-1"));
            assertTrue(e.getMessage().contains("platform"));
            verify(generator, never()).refineIdea(any());
        }

        @Test
        @DisplayName("returns an already complete session as is")
        void alreadyComplete() {
            agent.submitAnswer("idea-1", "audience", "Hobby gardeners");
            agent.submitAnswer("idea-1", "platform", "Both");
            ClarificationSession first = agent.completeClarification("idea-1");

            assertSame(first, agent.completeClarification("idea-1"));
            verify(generator, times(1)).refineIdea(any());
        }

        @Test
        @DisplayName("unknown ideas are not found")
        void unknownIdea() {
            assertThrows(NotFoundException.class, () -> agent.completeClarification("nope"));
        }
    }

    @Test
    @DisplayName("getSession is empty for unknown or blank ids")
    void getSession() {
        assertEquals(Optional.empty(), agent.getSession("nope"));
        assertEquals(Optional.empty(), agent.getSession(null));
    }

    @Test
    @DisplayName("refinedIdeaOrSummary folds answers into the idea when no refined idea exists")
    void summary() {
        agent.startClarification("idea-1", IDEA);
        ClarificationSession session = agent.submitAnswer("idea-1", "audience", "Hobby gardeners");

        String summary = session.refinedIdeaOrSummary();
        assertTrue(summary.startsWith(IDEA));
        assertTrue(summary.contains("Q: Who is the target audience?\nA: Hobby gardeners"));
    }
}
