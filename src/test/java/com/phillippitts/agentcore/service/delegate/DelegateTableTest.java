package com.phillippitts.agentcore.service.delegate;

import com.phillippitts.agentcore.exception.DelegateNotFoundException;
import com.phillippitts.agentcore.testutil.TestDelegates;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DelegateTableTest {

    @Test
    void keepsRegistrationOrder() {
        DelegateTable table = DelegateTable.of(List.of(
                TestDelegates.of("search", a -> ""),
                TestDelegates.of("calc", a -> ""),
                TestDelegates.of("speak", a -> "")));

        assertThat(table.names()).containsExactly("search", "calc", "speak");
        assertThat(table.descriptions()).containsOnlyKeys("search", "calc", "speak");
        assertThat(table.size()).isEqualTo(3);
    }

    @Test
    void rejectsDuplicateNames() {
        assertThatThrownBy(() -> DelegateTable.of(List.of(
                TestDelegates.of("calc", a -> "1"),
                TestDelegates.of("calc", a -> "2"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate delegate name: calc");
    }

    @Test
    void rejectsBlankNames() {
        assertThatThrownBy(() -> DelegateTable.of(List.of(TestDelegates.of(" ", a -> ""))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void requireListsAvailableNames() {
        DelegateTable table = DelegateTable.of(List.of(TestDelegates.of("calc", a -> "")));

        assertThat(table.find("missing")).isEmpty();
        assertThatThrownBy(() -> table.require("missing"))
                .isInstanceOf(DelegateNotFoundException.class)
                .hasMessageContaining("missing")
                .hasMessageContaining("available: calc");
    }

    @Test
    void emptyTableHasNoDelegates() {
        assertThat(DelegateTable.empty().isEmpty()).isTrue();
        assertThat(DelegateTable.empty().find("anything")).isEmpty();
    }
}
