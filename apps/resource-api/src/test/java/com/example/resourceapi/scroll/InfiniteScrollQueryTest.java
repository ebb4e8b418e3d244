package com.example.resourceapi.scroll;

import com.example.resourceapi.common.exception.ValidationException;
import com.example.resourceapi.store.DocumentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("InfiniteScrollQuery")
class InfiniteScrollQueryTest {

    private static final String COLLECTION = "Grade";
    private static final String CURSOR = "65a1b2c3d4e5f60718293a4b";

    @Mock
    private DocumentStore store;

    private InfiniteScrollQuery query;

    @BeforeEach
    void setUp() {
        query = new InfiniteScrollQuery(store);
    }

    @Test
    @DisplayName("should query without a position on the first page")
    void shouldPlanFirstPage() {
        ScrollParameters parameters = new ScrollParameters(null, null, 2, "name", SortOrder.ASC);
        when(store.query(eq(COLLECTION), any())).thenReturn(Flux.just(
                Map.of("_id", "1", "name", "a"),
                Map.of("_id", "2", "name", "b"),
                Map.of("_id", "3", "name", "c")));

        StepVerifier.create(query.execute(COLLECTION, parameters))
                .assertNext(page -> {
                    assertThat(page.items()).hasSize(2);
                    assertThat(page.hasMore()).isTrue();
                    assertThat(page.nextCursor()).isEqualTo("2");
                })
                .verifyComplete();

        ArgumentCaptor<QueryPlan> plan = ArgumentCaptor.forClass(QueryPlan.class);
        verify(store).query(eq(COLLECTION), plan.capture());
        assertThat(plan.getValue().after()).isNull();
        assertThat(plan.getValue().fetchLimit()).isEqualTo(3);
    }

    @Test
    @DisplayName("should resume after the cursor document's current sort value")
    void shouldResolveCursorPosition() {
        ScrollParameters parameters = new ScrollParameters(null, CURSOR, 10, "created.at_time", SortOrder.DESC);
        when(store.get(COLLECTION, CURSOR)).thenReturn(Mono.just(
                Map.of("_id", CURSOR, "created", Map.of("at_time", "2024-01-01T00:00:00Z"))));
        when(store.query(eq(COLLECTION), any())).thenReturn(Flux.empty());

        StepVerifier.create(query.execute(COLLECTION, parameters))
                .assertNext(page -> assertThat(page.items()).isEmpty())
                .verifyComplete();

        ArgumentCaptor<QueryPlan> plan = ArgumentCaptor.forClass(QueryPlan.class);
        verify(store).query(eq(COLLECTION), plan.capture());
        assertThat(plan.getValue().after()).isEqualTo(new ScrollPosition("2024-01-01T00:00:00Z", CURSOR));
        assertThat(plan.getValue().order()).isEqualTo(SortOrder.DESC);
    }

    @Test
    @DisplayName("should fail with a validation error when the cursor document was deleted")
    void shouldRejectDeletedCursor() {
        ScrollParameters parameters = new ScrollParameters(null, CURSOR, 10, "name", SortOrder.ASC);
        when(store.get(COLLECTION, CURSOR)).thenReturn(Mono.empty());

        StepVerifier.create(query.execute(COLLECTION, parameters))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(ValidationException.class);
                    assertThat(error.getMessage()).contains(CURSOR);
                })
                .verify();

        verify(store, never()).query(any(), any());
    }
}
