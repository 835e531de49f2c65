package com.platform.provisioner.reconciliation;

import com.platform.provisioner.error.RemoteServiceException;
import com.platform.provisioner.error.ResourceNotFoundException;
import com.platform.provisioner.error.ValidationException;
import com.platform.provisioner.model.CustomDimension;
import com.platform.provisioner.model.CustomMetric;
import com.platform.provisioner.model.Description;
import com.platform.provisioner.model.DescriptionBuilder;
import com.platform.provisioner.model.Filter;
import com.platform.provisioner.model.Goal;
import com.platform.provisioner.model.ResourcePayloads;
import com.platform.provisioner.model.View;
import com.platform.provisioner.model.ViewDescription;
import com.platform.provisioner.model.WebProperty;
import com.platform.provisioner.observability.MetricsRegistry;
import com.platform.provisioner.remote.InMemoryManagementApi;
import com.platform.provisioner.remote.Session;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReconciliationEngineTest {
    
    private static final Session SESSION = Session.bearer("token-1234");
    private static final String ACCOUNT = "317979";
    
    private InMemoryManagementApi api;
    private MetricsRegistry metrics;
    private ReconciliationEngine engine;
    
    @BeforeEach
    void setUp() {
        api = new InMemoryManagementApi();
        metrics = new MetricsRegistry(new SimpleMeterRegistry());
        engine = engineFor(api, metrics);
    }
    
    static ReconciliationEngine engineFor(InMemoryManagementApi api, MetricsRegistry metrics) {
        ResourcePayloads payloads = ResourcePayloads.standalone();
        DiffEvaluator diff = new DiffEvaluator(payloads);
        UniqueKeyMatcher matcher = new UniqueKeyMatcher(payloads);
        return new ReconciliationEngine(
            new WebPropertyStage(api, diff, matcher, metrics),
            new CustomMetricsStage(api, diff, metrics),
            new CustomDimensionsStage(api, diff, metrics),
            new ViewsStage(api, diff, matcher, metrics),
            metrics);
    }
    
    private static WebProperty shop() {
        return WebProperty.builder().name("Shop").websiteUrl("https://shop.example").build();
    }
    
    private static CustomDimension dimension(String name) {
        return CustomDimension.builder().name(name).scope("SESSION").active(true).build();
    }
    
    private static Goal eventGoal(String name) {
        return Goal.builder()
            .name(name)
            .active(true)
            .type("EVENT")
            .eventDetails(Goal.EventDetails.builder()
                .useEventValue(true)
                .eventConditions(List.of(Goal.EventCondition.builder()
                    .type("CATEGORY").matchType("EXACT").expression("checkout").build()))
                .build())
            .build();
    }
    
    // ==================== Preconditions ====================
    
    @Nested
    @DisplayName("preconditions")
    class Preconditions {
        
        @Test
        void missing_account_id_fails_with_412_before_any_remote_call() {
            // given
            Description description = new DescriptionBuilder().webProperty(shop()).build();
            
            // when / then
            assertThatThrownBy(() -> engine.reconcile(SESSION, description).join())
                .isInstanceOf(CompletionException.class)
                .cause()
                .isInstanceOfSatisfying(ValidationException.class, e -> {
                    assertThat(e.getStatusCode()).isEqualTo(412);
                    assertThat(e.getField()).isEqualTo("accountId");
                });
            assertThat(api.calls()).isEmpty();
        }
        
        @Test
        void missing_web_property_fails_with_412() {
            Description description = new DescriptionBuilder().account(ACCOUNT).build();
            
            assertThatThrownBy(() -> engine.reconcile(SESSION, description).join())
                .hasCauseInstanceOf(ValidationException.class);
            assertThat(api.calls()).isEmpty();
        }
    }
    
    // ==================== Web Property ====================
    
    @Nested
    @DisplayName("web property")
    class WebPropertyResolution {
        
        @Test
        void inserts_single_web_property_and_makes_no_other_call() {
            // given
            Description description = new DescriptionBuilder().account(ACCOUNT).webProperty(shop()).build();
            
            // when
            Description result = engine.reconcile(SESSION, description).join();
            
            // then
            assertThat(api.calls()).containsExactly("webproperties.insert");
            assertThat(result.webPropertyId()).isEqualTo("UA-317979-1");
            assertThat(result.webProperty().industryVertical()).isEqualTo("UNSPECIFIED");
            assertThat(api.webProperties()).singleElement()
                .extracting(WebProperty::name).isEqualTo("Shop");
        }
        
        @Test
        void known_id_is_fetched_and_left_alone_when_equal() {
            api.seedWebProperty(shop().withId("UA-317979-4"));
            Description description = new DescriptionBuilder()
                .account(ACCOUNT)
                .webProperty(shop().withId("UA-317979-4"))
                .build();
            
            Description result = engine.reconcile(SESSION, description).join();
            
            assertThat(api.calls()).containsExactly("webproperties.get");
            assertThat(result.webPropertyId()).isEqualTo("UA-317979-4");
        }
        
        @Test
        void known_id_is_patched_when_remote_differs() {
            api.seedWebProperty(shop().toBuilder().id("UA-317979-4").websiteUrl("https://old.example").build());
            Description description = new DescriptionBuilder()
                .account(ACCOUNT)
                .webProperty(shop().withId("UA-317979-4"))
                .build();
            
            engine.reconcile(SESSION, description).join();
            
            assertThat(api.calls()).containsExactly("webproperties.get", "webproperties.patch");
            assertThat(api.webProperties().get(0).websiteUrl()).isEqualTo("https://shop.example");
        }
        
        @Test
        void unique_key_adopts_id_of_first_match_and_patches_difference() {
            // given
            api.seedWebProperty(WebProperty.builder().id("UA-317979-2").name("Blog").build())
                .seedWebProperty(WebProperty.builder().id("UA-317979-7").name("Shop")
                    .websiteUrl("https://old.example").build());
            Description description = new DescriptionBuilder()
                .account(ACCOUNT)
                .webProperty(shop().toBuilder().uniqueKey("name").build())
                .build();
            
            // when
            Description result = engine.reconcile(SESSION, description).join();
            
            // then
            assertThat(api.calls()).containsExactly("webproperties.list", "webproperties.patch");
            assertThat(result.webPropertyId()).isEqualTo("UA-317979-7");
            assertThat(result.webProperty().uniqueKey()).isEqualTo("name");
        }
        
        @Test
        void unique_key_match_that_is_equal_is_not_patched() {
            api.seedWebProperty(shop().withId("UA-317979-7"));
            Description description = new DescriptionBuilder()
                .account(ACCOUNT)
                .webProperty(shop().toBuilder().uniqueKey("name").build())
                .build();
            
            engine.reconcile(SESSION, description).join();
            
            assertThat(api.calls()).containsExactly("webproperties.list");
        }
        
        @Test
        void unique_key_without_match_fails_with_not_found() {
            api.seedWebProperty(WebProperty.builder().id("UA-317979-2").name("Blog").build());
            Description description = new DescriptionBuilder()
                .account(ACCOUNT)
                .webProperty(shop().toBuilder().uniqueKey("name").build())
                .customDimensions(List.of(dimension("Position")))
                .build();
            
            assertThatThrownBy(() -> engine.reconcile(SESSION, description).join())
                .hasCauseInstanceOf(ResourceNotFoundException.class);
            assertThat(api.calls()).containsExactly("webproperties.list");
        }
    }
    
    // ==================== Positional Collections ====================
    
    @Nested
    @DisplayName("custom metrics and dimensions")
    class PositionalCollections {
        
        @Test
        void missing_positions_are_inserted_with_positional_ids() {
            // given
            Description description = new DescriptionBuilder()
                .account(ACCOUNT)
                .webProperty(shop())
                .customMetrics(List.of(CustomMetric.builder().name("Revenue").scope("HIT").type("CURRENCY").active(true).build()))
                .customDimensions(List.of(dimension("Position"), dimension("Date")))
                .build();
            
            // when
            Description result = engine.reconcile(SESSION, description).join();
            
            // then
            assertThat(api.calls()).containsExactly(
                "webproperties.insert",
                "customMetrics.list", "customMetrics.insert",
                "customDimensions.list", "customDimensions.insert", "customDimensions.insert");
            assertThat(result.customMetrics()).extracting(CustomMetric::id).containsExactly("ga:metric1");
            assertThat(result.customDimensions()).extracting(CustomDimension::id)
                .containsExactly("ga:dimension1", "ga:dimension2");
            assertThat(result.customDimensions()).extracting(CustomDimension::index).containsExactly(1, 2);
        }
        
        @Test
        void reordering_declared_items_patches_by_position() {
            // given
            api.seedWebProperty(shop().withId("UA-317979-1"))
                .seedDimensions("UA-317979-1", List.of(
                    dimension("Position").withPosition(1),
                    dimension("Date").withPosition(2)));
            Description description = new DescriptionBuilder()
                .account(ACCOUNT)
                .webProperty(shop().withId("UA-317979-1"))
                .customDimensions(List.of(dimension("Date"), dimension("Position")))
                .build();
            
            // when
            engine.reconcile(SESSION, description).join();
            
            // then
            assertThat(api.count("customDimensions.patch")).isEqualTo(2);
            assertThat(api.dimensions("UA-317979-1")).extracting(CustomDimension::name)
                .containsExactly("Date", "Position");
            assertThat(api.dimensions("UA-317979-1")).extracting(CustomDimension::id)
                .containsExactly("ga:dimension1", "ga:dimension2");
        }
        
        @Test
        void equal_positions_are_left_alone_and_keep_remote_id() {
            api.seedWebProperty(shop().withId("UA-317979-1"))
                .seedDimensions("UA-317979-1", List.of(dimension("Position").withPosition(1)));
            Description description = new DescriptionBuilder()
                .account(ACCOUNT)
                .webProperty(shop().withId("UA-317979-1"))
                .customDimensions(List.of(dimension("Position"), dimension("Date")))
                .build();
            
            Description result = engine.reconcile(SESSION, description).join();
            
            assertThat(api.mutations()).containsExactly("customDimensions.insert");
            assertThat(result.customDimensions()).extracting(CustomDimension::id)
                .containsExactly("ga:dimension1", "ga:dimension2");
            assertThat(metrics.getCount("provisioner.reconciliation.action",
                "kind", "customDimension", "action", "UNCHANGED")).isEqualTo(1.0);
        }
        
        @Test
        void empty_collections_make_no_list_call() {
            Description description = new DescriptionBuilder()
                .account(ACCOUNT)
                .webProperty(shop())
                .customMetrics(List.of())
                .build();
            
            engine.reconcile(SESSION, description).join();
            
            assertThat(api.calls()).doesNotContain("customMetrics.list", "customDimensions.list");
        }
    }
    
    // ==================== Views and Goals ====================
    
    @Nested
    @DisplayName("views and goals")
    class ViewsAndGoals {
        
        @Test
        void new_view_is_inserted_without_listing_and_its_goals_follow() {
            // given
            Description description = new DescriptionBuilder()
                .account(ACCOUNT)
                .webProperty(shop())
                .view(View.builder().name("All traffic").websiteUrl("https://shop.example").build(),
                    List.of(eventGoal("Checkout")),
                    List.of(Filter.builder().name("No internal").type("EXCLUDE").uniqueKey("name").build()))
                .build();
            
            // when
            Description result = engine.reconcile(SESSION, description).join();
            
            // then
            assertThat(api.calls()).containsExactly(
                "webproperties.insert", "profiles.insert", "goals.list", "goals.insert");
            ViewDescription view = result.views().get(0);
            assertThat(view.view().id()).isEqualTo("1000");
            assertThat(view.view().type()).isEqualTo("WEB");
            assertThat(view.goals()).extracting(Goal::id).containsExactly("1");
            assertThat(view.filters()).extracting(Filter::name).containsExactly("No internal");
        }
        
        @Test
        void views_are_listed_once_when_any_view_needs_lookup() {
            api.seedWebProperty(shop().withId("UA-317979-1"))
                .seedView("UA-317979-1", View.builder().id("55").name("Raw").build())
                .seedView("UA-317979-1", View.builder().id("56").name("Filtered").build());
            Description description = new DescriptionBuilder()
                .account(ACCOUNT)
                .webProperty(shop().withId("UA-317979-1"))
                .view(View.builder().id("55").name("Raw data").build())
                .view(View.builder().name("Filtered").uniqueKey("name").build())
                .build();
            
            Description result = engine.reconcile(SESSION, description).join();
            
            assertThat(api.count("profiles.list")).isEqualTo(1);
            assertThat(api.mutations()).containsExactly("profiles.patch");
            assertThat(result.views()).extracting(v -> v.view().id()).containsExactly("55", "56");
            assertThat(api.views("UA-317979-1").get(0).name()).isEqualTo("Raw data");
        }
        
        @Test
        void unresolved_view_is_left_as_declared_and_goals_are_skipped() {
            api.seedWebProperty(shop().withId("UA-317979-1"));
            Description description = new DescriptionBuilder()
                .account(ACCOUNT)
                .webProperty(shop().withId("UA-317979-1"))
                .view(View.builder().name("Missing").uniqueKey("name").build(),
                    List.of(eventGoal("Checkout")), List.of())
                .build();
            
            Description result = engine.reconcile(SESSION, description).join();
            
            assertThat(api.calls()).containsExactly("webproperties.get", "profiles.list");
            assertThat(result.views().get(0).view().id()).isNull();
        }
        
        @Test
        void unknown_view_id_is_a_no_op() {
            api.seedWebProperty(shop().withId("UA-317979-1"));
            Description description = new DescriptionBuilder()
                .account(ACCOUNT)
                .webProperty(shop().withId("UA-317979-1"))
                .view(View.builder().id("404").name("Gone").build(), List.of(eventGoal("Checkout")), List.of())
                .build();
            
            Description result = engine.reconcile(SESSION, description).join();
            
            assertThat(api.mutations()).isEmpty();
            assertThat(api.calls()).containsExactly("webproperties.get", "profiles.list");
            assertThat(result.views().get(0).goals()).extracting(Goal::name).containsExactly("Checkout");
        }
        
        @Test
        void goals_are_patched_by_position() {
            api.seedWebProperty(shop().withId("UA-317979-1"))
                .seedView("UA-317979-1", View.builder().id("55").name("Raw").build())
                .seedGoals("55", List.of(eventGoal("Old").withPosition(1)));
            Description description = new DescriptionBuilder()
                .account(ACCOUNT)
                .webProperty(shop().withId("UA-317979-1"))
                .view(View.builder().id("55").name("Raw").build(),
                    List.of(eventGoal("Checkout"), eventGoal("Signup")), List.of())
                .build();
            
            Description result = engine.reconcile(SESSION, description).join();
            
            assertThat(api.mutations()).containsExactly("goals.patch", "goals.insert");
            assertThat(result.views().get(0).goals()).extracting(Goal::id).containsExactly("1", "2");
            assertThat(api.goals("55")).extracting(Goal::name).containsExactly("Checkout", "Signup");
        }
    }
    
    // ==================== Whole Runs ====================
    
    @Nested
    @DisplayName("whole runs")
    class WholeRuns {
        
        private Description fullDescription() {
            return new DescriptionBuilder()
                .account(ACCOUNT)
                .webProperty(shop())
                .customMetrics(List.of(CustomMetric.builder().name("Revenue").scope("HIT").type("CURRENCY").active(true).build()))
                .customDimensions(List.of(dimension("Position"), dimension("Date")))
                .view(View.builder().name("All traffic").currency("EUR").timezone("Europe/Berlin").build(),
                    List.of(eventGoal("Checkout")), List.of())
                .build();
        }
        
        @Test
        void second_run_with_returned_snapshot_changes_nothing() {
            // given
            Description first = engine.reconcile(SESSION, fullDescription()).join();
            int callsAfterFirstRun = api.mutations().size();
            
            // when
            Description second = engine.reconcile(SESSION, first).join();
            
            // then
            assertThat(api.mutations()).hasSize(callsAfterFirstRun);
            assertThat(second).isEqualTo(first);
        }
        
        @Test
        void ids_stay_stable_across_runs() {
            Description first = engine.reconcile(SESSION, fullDescription()).join();
            Description second = engine.reconcile(SESSION, first).join();
            
            assertThat(second.webPropertyId()).isEqualTo(first.webPropertyId());
            assertThat(second.views().get(0).view().id()).isEqualTo(first.views().get(0).view().id());
            assertThat(api.webProperties()).hasSize(1);
            assertThat(api.views(first.webPropertyId())).hasSize(1);
        }
        
        @Test
        void failure_mid_pipeline_propagates_unchanged_and_keeps_earlier_changes() {
            // given
            RemoteServiceException rejection = InMemoryManagementApi.rejection(400, "invalid");
            api.failNext("customDimensions.list", rejection);
            
            // when / then
            assertThatThrownBy(() -> engine.reconcile(SESSION, fullDescription()).join())
                .isInstanceOf(CompletionException.class)
                .hasCauseReference(rejection);
            assertThat(api.webProperties()).hasSize(1);
            assertThat(api.metrics("UA-317979-1")).hasSize(1);
            assertThat(api.calls()).doesNotContain("profiles.insert");
        }
    }
}
