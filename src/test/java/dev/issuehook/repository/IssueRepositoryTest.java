package dev.issuehook.repository;

import jakarta.persistence.QueryHint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.data.jpa.repository.QueryHints;

import java.lang.reflect.Method;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class IssueRepositoryTest {

    @ParameterizedTest
    @ValueSource(strings = {"searchTitles", "searchBodies"})
    @DisplayName("full-text queries carry a statement timeout so abandoned searches stop in the database")
    void fullTextQueriesAreBounded(String methodName) throws Exception {
        Method method = IssueRepository.class.getMethod(methodName, String.class, long.class, String.class, int.class);

        QueryHints hints = method.getAnnotation(QueryHints.class);

        assertThat(hints).isNotNull();
        assertThat(hints.value())
                .extracting(QueryHint::name, QueryHint::value)
                .containsExactly(tuple(
                        "jakarta.persistence.query.timeout", IssueRepository.SEARCH_QUERY_TIMEOUT_MS));
        assertThat(Long.parseLong(IssueRepository.SEARCH_QUERY_TIMEOUT_MS)).isPositive();
    }
}
