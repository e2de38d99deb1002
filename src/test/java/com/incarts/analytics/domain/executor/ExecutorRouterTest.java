package com.incarts.analytics.domain.executor;

import com.incarts.analytics.domain.catalog.AnalyticsTemplates;
import com.incarts.analytics.domain.exception.BackendQueryException;
import com.incarts.analytics.domain.exception.BackendUnavailableException;
import com.incarts.analytics.domain.exception.UnsupportedPlanException;
import com.incarts.analytics.domain.filter.FilterSet;
import com.incarts.analytics.domain.plan.QueryPlan;
import com.incarts.analytics.domain.plan.QueryPlanBuilder;
import com.incarts.analytics.domain.result.ExecutionResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ExecutorRouterTest {

    @Mock
    private QueryExecutor direct;

    @Mock
    private QueryExecutor emulated;

    private QueryPlan plan;

    @BeforeEach
    void setUp() {
        plan = new QueryPlanBuilder().build(AnalyticsTemplates.TOTAL_CLICKS, FilterSet.empty());
    }

    @Test
    void testExecute_PreferredExecutorAnswers() {
        // Given
        ExecutionResult result = ExecutionResult.scalar(10L, Collections.emptyList());
        when(direct.execute(plan)).thenReturn(result);
        ExecutorRouter router = new ExecutorRouter(List.of(direct, emulated));

        // When / Then
        assertSame(result, router.execute(plan));
        verifyNoInteractions(emulated);
    }

    @Test
    void testExecute_UnavailableFallsThrough() {
        // Given
        ExecutionResult result = ExecutionResult.scalar(10L, Collections.emptyList());
        when(direct.kind()).thenReturn(ExecutorKind.DIRECT);
        when(direct.execute(plan)).thenThrow(new BackendUnavailableException(ExecutorKind.DIRECT, "not configured"));
        when(emulated.execute(plan)).thenReturn(result);
        ExecutorRouter router = new ExecutorRouter(List.of(direct, emulated));

        // When / Then
        assertSame(result, router.execute(plan));
    }

    @Test
    void testExecute_UnsupportedFallsThrough() {
        // Given
        ExecutionResult result = ExecutionResult.scalar(10L, Collections.emptyList());
        when(emulated.kind()).thenReturn(ExecutorKind.EMULATED);
        when(emulated.execute(plan)).thenThrow(new UnsupportedPlanException(ExecutorKind.EMULATED, "grouped"));
        when(direct.execute(plan)).thenReturn(result);
        ExecutorRouter router = new ExecutorRouter(List.of(emulated, direct));

        // When / Then
        assertSame(result, router.execute(plan));
    }

    @Test
    void testExecute_QueryFailureIsNotRetriedElsewhere() {
        // Given
        when(direct.execute(plan)).thenThrow(new BackendQueryException(ExecutorKind.DIRECT, "syntax error", null));
        ExecutorRouter router = new ExecutorRouter(List.of(direct, emulated));

        // When / Then
        assertThrows(BackendQueryException.class, () -> router.execute(plan));
        verifyNoInteractions(emulated);
    }

    @Test
    void testExecute_AllDeclineThrowsLast() {
        // Given
        UnsupportedPlanException last = new UnsupportedPlanException(ExecutorKind.EMULATED, "grouped");
        when(direct.kind()).thenReturn(ExecutorKind.DIRECT);
        when(emulated.kind()).thenReturn(ExecutorKind.EMULATED);
        when(direct.execute(plan)).thenThrow(new BackendUnavailableException(ExecutorKind.DIRECT, "not configured"));
        when(emulated.execute(plan)).thenThrow(last);
        ExecutorRouter router = new ExecutorRouter(List.of(direct, emulated));

        // When / Then
        assertSame(last, assertThrows(UnsupportedPlanException.class, () -> router.execute(plan)));
    }

    @Test
    void testOrder() {
        // Given
        when(direct.kind()).thenReturn(ExecutorKind.DIRECT);
        when(emulated.kind()).thenReturn(ExecutorKind.EMULATED);

        // When
        ExecutorRouter router = new ExecutorRouter(List.of(emulated, direct));

        // Then
        assertEquals(List.of(ExecutorKind.EMULATED, ExecutorKind.DIRECT), router.order());
        assertEquals(ExecutorKind.EMULATED, router.kind());
    }

    @Test
    void testConstructor_RequiresExecutor() {
        assertThrows(IllegalArgumentException.class, () -> new ExecutorRouter(List.of()));
    }
}
