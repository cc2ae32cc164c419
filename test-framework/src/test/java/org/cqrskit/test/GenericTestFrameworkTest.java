/*
 *
 *  Copyright 2025 Johan Haleby
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *         http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package org.cqrskit.test;

import org.cqrskit.command.BankAccountCommand;
import org.cqrskit.command.DepositMoney;
import org.cqrskit.domain.*;
import org.cqrskit.event.EventEnvelope;
import org.cqrskit.eventstore.inmemory.MemStore;
import org.cqrskit.eventstore.inmemory.MemStoreAggregateContext;
import org.cqrskit.query.Query;
import org.cqrskit.query.Reactor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayName("generic test framework")
@DisplayNameGeneration(ReplaceUnderscores.class)
class GenericTestFrameworkTest {

    private BankAccountServices services;
    private GenericTestFramework<BankAccount, BankAccountCommand, BankAccountEvent, BankAccountException, BankAccountServices, MemStoreAggregateContext<BankAccount>> framework;
    private List<String> log;

    @BeforeEach
    void create_framework() {
        services = new StubBankAccountServices();
        framework = TestFramework.with(BankAccount::new, services);
        log = new CopyOnWriteArrayList<>();
    }

    @Test
    void keeps_the_services() {
        assertThat(framework.services()).isSameAs(services);
    }

    @Test
    void queries_are_kept_in_the_order_they_were_added_without_deduplication() {
        // Given
        Query<BankAccountEvent> q1 = recordingQuery("q1");
        Query<BankAccountEvent> q2 = recordingQuery("q2");
        Query<BankAccountEvent> q3 = recordingQuery("q3");

        // When
        GenericTestFramework<BankAccount, BankAccountCommand, BankAccountEvent, BankAccountException, BankAccountServices, MemStoreAggregateContext<BankAccount>> configured =
                framework.andQuery(q1).andQueries(List.of(q2, q1)).andQuery(q3);

        // Then
        assertThat(configured.queries()).containsExactly(q1, q2, q1, q3);
    }

    @Test
    void reactors_are_kept_in_the_order_they_were_added_without_deduplication() {
        // Given
        AccountReactor r1 = recordingReactor("r1");
        AccountReactor r2 = recordingReactor("r2");

        // When
        GenericTestFramework<BankAccount, BankAccountCommand, BankAccountEvent, BankAccountException, BankAccountServices, MemStoreAggregateContext<BankAccount>> configured =
                framework.usingMemStore().andReactor(r1).andReactors(List.of(r2, r1));

        // Then
        assertThat(configured.reactors()).containsExactly(r1, r2, r1);
    }

    @Test
    void configuration_calls_leave_the_template_untouched() {
        // Given
        GenericTestFramework<BankAccount, BankAccountCommand, BankAccountEvent, BankAccountException, BankAccountServices, MemStoreAggregateContext<BankAccount>> template = framework.andQuery(recordingQuery("q1"));

        // When
        template.andQuery(recordingQuery("q2")).andReactor(recordingReactor("r1"));

        // Then
        assertAll(
                () -> assertThat(template.queries()).hasSize(1),
                () -> assertThat(template.reactors()).isEmpty(),
                () -> assertThat(template.contextAndStore()).isEmpty()
        );
    }

    @Nested
    @DisplayName("context and store")
    class StoreBinding {

        @Test
        void no_context_and_store_is_defined_initially() {
            assertThat(framework.contextAndStore()).isEmpty();
        }

        @Test
        void using_mem_store_binds_a_mem_store_for_the_default_aggregate_id() {
            // When
            GenericTestFramework<BankAccount, BankAccountCommand, BankAccountEvent, BankAccountException, BankAccountServices, MemStoreAggregateContext<BankAccount>> bound = framework.usingMemStore();

            // Then
            assertThat(bound.contextAndStore()).hasValueSatisfying(contextAndStore -> assertAll(
                    () -> assertThat(contextAndStore.context().aggregateId()).isEqualTo(GenericTestFramework.DEFAULT_AGGREGATE_ID),
                    () -> assertThat(contextAndStore.store()).isInstanceOf(MemStore.class)
            ));
        }

        @Test
        void changing_the_store_keeps_the_queries_in_order() {
            // Given
            Query<BankAccountEvent> q1 = recordingQuery("q1");
            Query<BankAccountEvent> q2 = recordingQuery("q2");
            MemStore<BankAccount, BankAccountEvent> store = new MemStore<>(BankAccount::new);

            // When
            GenericTestFramework<BankAccount, BankAccountCommand, BankAccountEvent, BankAccountException, BankAccountServices, MemStoreAggregateContext<BankAccount>> bound =
                    framework.andQuery(q1).andQuery(q2).usingMemStore().usingContextAndStore(store.loadAggregate("account1"), store);

            // Then
            assertAll(
                    () -> assertThat(bound.queries()).containsExactly(q1, q2),
                    () -> assertThat(bound.contextAndStore()).hasValueSatisfying(contextAndStore -> assertThat(contextAndStore.store()).isSameAs(store))
            );
        }

        @Test
        void changing_the_store_after_reactors_have_been_added_throws_ise() {
            // Given
            GenericTestFramework<BankAccount, BankAccountCommand, BankAccountEvent, BankAccountException, BankAccountServices, MemStoreAggregateContext<BankAccount>> withReactor =
                    framework.usingMemStore().andReactor(recordingReactor("r1"));
            MemStore<BankAccount, BankAccountEvent> store = new MemStore<>(BankAccount::new);

            // When
            Throwable throwable = catchThrowable(() -> withReactor.usingContextAndStore(store.loadAggregate("account1"), store));

            // Then
            assertThat(throwable).isExactlyInstanceOf(IllegalStateException.class).hasMessage("reactors must be added after context and store defined");
        }

        @Test
        void adding_a_reactor_before_a_store_is_chosen_binds_the_default_mem_store() {
            // When
            GenericTestFramework<BankAccount, BankAccountCommand, BankAccountEvent, BankAccountException, BankAccountServices, MemStoreAggregateContext<BankAccount>> withReactor =
                    framework.andReactor(recordingReactor("r1"));

            // Then
            assertAll(
                    () -> assertThat(withReactor.contextAndStore()).hasValueSatisfying(contextAndStore -> assertThat(contextAndStore.store()).isInstanceOf(MemStore.class)),
                    () -> assertThat(catchThrowable(withReactor::usingMemStore)).isExactlyInstanceOf(IllegalStateException.class)
            );
        }

        @Test
        void a_reactor_added_before_a_store_is_chosen_is_invoked() {
            // Given
            AggregateTestExecutor<BankAccount, BankAccountCommand, BankAccountEvent, BankAccountException, BankAccountServices, MemStoreAggregateContext<BankAccount>> executor =
                    framework.andReactor(recordingReactor("r1")).given(List.of(new AccountOpened("account1")));

            // When
            executor.when(new DepositMoney(100)).thenExpectEvents(List.of(new CustomerDepositedMoney(100, 100)));

            // Then
            assertThat(log).containsExactly("r1 [CustomerDepositedMoney]");
        }

        @Test
        void every_test_gets_its_own_mem_store() {
            // Given
            GenericTestFramework<BankAccount, BankAccountCommand, BankAccountEvent, BankAccountException, BankAccountServices, MemStoreAggregateContext<BankAccount>> template = framework.usingMemStore();
            template.given(List.of(new AccountOpened("account1"))).when(new DepositMoney(100));

            // When
            AggregateTestExecutor<BankAccount, BankAccountCommand, BankAccountEvent, BankAccountException, BankAccountServices, MemStoreAggregateContext<BankAccount>> executor = template.givenNoPreviousEvents();

            // Then
            assertThat(executor.committedEvents()).isEmpty();
        }

        @Test
        void every_test_from_a_mem_store_template_sees_exactly_its_own_previous_events() {
            // Given
            GenericTestFramework<BankAccount, BankAccountCommand, BankAccountEvent, BankAccountException, BankAccountServices, MemStoreAggregateContext<BankAccount>> template = framework.usingMemStore();
            template.given(List.of(new AccountOpened("account1"))).when(new DepositMoney(100));

            // When
            AggregateTestExecutor<BankAccount, BankAccountCommand, BankAccountEvent, BankAccountException, BankAccountServices, MemStoreAggregateContext<BankAccount>> executor = template.given(List.of(new AccountOpened("account1")));

            // Then
            assertThat(executor.committedEvents()).extracting(EventEnvelope::payload).containsExactly(new AccountOpened("account1"));
            executor.when(new DepositMoney(1)).thenExpectEvents(List.of(new CustomerDepositedMoney(1, 1)));
        }

        @Test
        void a_context_and_store_instance_can_only_be_used_by_one_test() {
            // Given
            MemStore<BankAccount, BankAccountEvent> store = new MemStore<>(BankAccount::new);
            GenericTestFramework<BankAccount, BankAccountCommand, BankAccountEvent, BankAccountException, BankAccountServices, MemStoreAggregateContext<BankAccount>> template =
                    framework.usingContextAndStore(store.loadAggregate("account1"), store);
            template.given(List.of(new AccountOpened("account1"))).when(new DepositMoney(100));

            // When
            Throwable throwable = catchThrowable(() -> template.andQuery(recordingQuery("q1")).given(List.of(new AccountOpened("account1"))));

            // Then
            assertAll(
                    () -> assertThat(throwable).isExactlyInstanceOf(IllegalStateException.class).hasMessageStartingWith("The context and store passed to usingContextAndStore can only be used by one test"),
                    () -> assertThat(store.loadEvents("account1")).extracting(EventEnvelope::payload).containsExactly(new AccountOpened("account1"), new CustomerDepositedMoney(100, 100))
            );
        }

        @Test
        void the_test_of_a_context_and_store_instance_executes_commands_on_the_aggregate_of_the_context() {
            // Given
            MemStore<BankAccount, BankAccountEvent> store = new MemStore<>(BankAccount::new);

            // When
            AggregateTestExecutor<BankAccount, BankAccountCommand, BankAccountEvent, BankAccountException, BankAccountServices, MemStoreAggregateContext<BankAccount>> executor =
                    framework.usingContextAndStore(store.loadAggregate("account1"), store).given(List.of(new AccountOpened("account1")));

            // Then
            assertAll(
                    () -> assertThat(executor.aggregateId()).isEqualTo("account1"),
                    () -> assertThat(executor.contextAndStore().store()).isSameAs(store),
                    () -> assertThat(store.loadEvents("account1")).extracting(EventEnvelope::payload).containsExactly(new AccountOpened("account1"))
            );
        }

        @Test
        void a_context_and_store_factory_gives_every_test_its_own_state() {
            // Given
            Supplier<ContextAndStore<BankAccount, BankAccountEvent, MemStoreAggregateContext<BankAccount>>> contextAndStoreFactory = () -> {
                MemStore<BankAccount, BankAccountEvent> store = new MemStore<>(BankAccount::new);
                return new ContextAndStore<>(store.loadAggregate("account1"), store);
            };
            GenericTestFramework<BankAccount, BankAccountCommand, BankAccountEvent, BankAccountException, BankAccountServices, MemStoreAggregateContext<BankAccount>> template =
                    framework.usingContextAndStore(contextAndStoreFactory);
            template.given(List.of(new AccountOpened("account1"))).when(new DepositMoney(100));

            // When
            AggregateTestExecutor<BankAccount, BankAccountCommand, BankAccountEvent, BankAccountException, BankAccountServices, MemStoreAggregateContext<BankAccount>> executor = template.given(List.of(new AccountOpened("account1")));

            // Then
            assertAll(
                    () -> assertThat(executor.aggregateId()).isEqualTo("account1"),
                    () -> assertThat(executor.committedEvents()).extracting(EventEnvelope::payload).containsExactly(new AccountOpened("account1")),
                    () -> executor.when(new DepositMoney(1)).thenExpectEvents(List.of(new CustomerDepositedMoney(1, 1)))
            );
        }

        @Test
        void inspecting_the_context_and_store_does_not_use_up_a_context_and_store_instance() {
            // Given
            MemStore<BankAccount, BankAccountEvent> store = new MemStore<>(BankAccount::new);
            GenericTestFramework<BankAccount, BankAccountCommand, BankAccountEvent, BankAccountException, BankAccountServices, MemStoreAggregateContext<BankAccount>> bound =
                    framework.usingContextAndStore(store.loadAggregate("account1"), store);

            // When
            bound.contextAndStore();

            // Then
            assertAll(
                    () -> assertThat(bound.contextAndStore()).hasValueSatisfying(contextAndStore -> assertThat(contextAndStore.store()).isSameAs(store)),
                    () -> assertThat(bound.givenNoPreviousEvents().contextAndStore().store()).isSameAs(store)
            );
        }

        @Test
        void inspecting_a_mem_store_binding_returns_a_new_store_that_no_test_uses() {
            // Given
            GenericTestFramework<BankAccount, BankAccountCommand, BankAccountEvent, BankAccountException, BankAccountServices, MemStoreAggregateContext<BankAccount>> bound = framework.usingMemStore();

            // When
            ContextAndStore<BankAccount, BankAccountEvent, MemStoreAggregateContext<BankAccount>> inspected = bound.contextAndStore().orElseThrow();

            // Then
            assertAll(
                    () -> assertThat(bound.contextAndStore()).hasValueSatisfying(other -> assertThat(other.store()).isNotSameAs(inspected.store())),
                    () -> assertThat(bound.givenNoPreviousEvents().contextAndStore().store()).isNotSameAs(inspected.store())
            );
        }
    }

    @Nested
    @DisplayName("given")
    class Given {

        @Test
        void given_no_previous_events_creates_an_executor_with_an_empty_history() {
            // When
            AggregateTestExecutor<BankAccount, BankAccountCommand, BankAccountEvent, BankAccountException, BankAccountServices, MemStoreAggregateContext<BankAccount>> executor = framework.givenNoPreviousEvents();

            // Then
            assertAll(
                    () -> assertThat(executor.previousEvents()).isEmpty(),
                    () -> assertThat(executor.committedEvents()).isEmpty()
            );
        }

        @Test
        void given_commits_the_previous_events_in_order() {
            // Given
            List<BankAccountEvent> previousEvents = List.of(new AccountOpened("account1"), new CustomerDepositedMoney(100, 100), new CustomerWithdrewCash(30, 70));

            // When
            AggregateTestExecutor<BankAccount, BankAccountCommand, BankAccountEvent, BankAccountException, BankAccountServices, MemStoreAggregateContext<BankAccount>> executor = framework.given(previousEvents);

            // Then
            assertAll(
                    () -> assertThat(executor.previousEvents()).isEqualTo(previousEvents),
                    () -> assertThat(executor.committedEvents()).extracting(EventEnvelope::payload).isEqualTo(previousEvents),
                    () -> assertThat(executor.committedEvents()).extracting(EventEnvelope::sequence).containsExactly(1L, 2L, 3L)
            );
        }

        @Test
        void previous_events_are_neither_dispatched_to_queries_nor_handed_to_reactors() {
            // When
            framework.andQuery(recordingQuery("q1")).andReactor(recordingReactor("r1")).given(List.of(new AccountOpened("account1"), new CustomerDepositedMoney(100, 100)));

            // Then
            assertThat(log).isEmpty();
        }

        @Test
        void executor_holds_the_configuration_of_the_framework() {
            // Given
            Query<BankAccountEvent> q1 = recordingQuery("q1");
            AccountReactor r1 = recordingReactor("r1");

            // When
            AggregateTestExecutor<BankAccount, BankAccountCommand, BankAccountEvent, BankAccountException, BankAccountServices, MemStoreAggregateContext<BankAccount>> executor =
                    framework.usingMemStore().andQuery(q1).andReactor(r1).given(List.of(new AccountOpened("account1")));

            // Then
            assertAll(
                    () -> assertThat(executor.services()).isSameAs(services),
                    () -> assertThat(executor.queries()).containsExactly(q1),
                    () -> assertThat(executor.reactors()).containsExactly(r1),
                    () -> assertThat(executor.previousEvents()).containsExactly(new AccountOpened("account1")),
                    () -> assertThat(executor.aggregateId()).isEqualTo(GenericTestFramework.DEFAULT_AGGREGATE_ID)
            );
        }
    }

    @Test
    void throws_iae_when_aggregate_factory_is_null() {
        // When
        Throwable throwable = catchThrowable(() -> TestFramework.<BankAccount, BankAccountCommand, BankAccountEvent, BankAccountException, BankAccountServices>with(null, services));

        // Then
        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessage("Aggregate factory cannot be null");
    }

    private Query<BankAccountEvent> recordingQuery(String name) {
        return (aggregateId, events) -> log.add(name + " " + describe(events));
    }

    private AccountReactor recordingReactor(String name) {
        return (context, aggregateId, services, events) -> {
            log.add(name + " " + describe(events));
            return List.of();
        };
    }

    private static String describe(List<EventEnvelope<BankAccountEvent>> events) {
        return events.stream().map(envelope -> envelope.payload().eventType()).collect(Collectors.joining(", ", "[", "]"));
    }

    private interface AccountReactor extends Reactor<BankAccount, BankAccountEvent, BankAccountException, BankAccountServices, MemStoreAggregateContext<BankAccount>> {
    }
}
