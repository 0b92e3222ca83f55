package eu.devmetrics.app.git;

import eu.devmetrics.app.metrics.TimeWindow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GitHistoryCollectorTest {

    private static final Path PATH = Path.of("repo");
    private static final RepositoryRef REPOSITORY = RepositoryRef.of("repo", PATH);
    private static final TimeWindow WINDOW =
            TimeWindow.of(Instant.parse("2024-03-01T00:00:00Z"), Instant.parse("2024-03-31T00:00:00Z"));
    private static final String HASH = "c".repeat(40);

    @Mock
    private GitCommandExecutor executor;

    private GitHistoryCollector collector;

    @BeforeEach
    void setUp() {
        collector = new GitHistoryCollector(executor, new GitLogParser());
    }

    @Test
    void testCollect_parsesEveryQuery() throws Exception {
        // Arrange
        when(executor.execute(eq(PATH), anyList())).thenAnswer(invocation -> {
            List<String> arguments = invocation.getArgument(1);
            switch (arguments.get(0)) {
                case "tag":
                    return "v1.0.0|2024-03-10T12:00:00+00:00\nnightly";
                case "branch":
                    return "* main\n  develop\n  remotes/origin/HEAD -> origin/main";
                case "shortlog":
                    return "     2\tJane Doe <jane@example.com>";
                default:
                    if (arguments.contains("--name-only")) {
                        return HASH + "\n\nsrc/App.java";
                    }
                    if (arguments.contains("--numstat")) {
                        return HASH + "|Jane Doe|jane@example.com|2024-03-05T10:00:00+00:00|Add app\n3\t1\tsrc/App.java";
                    }
                    return HASH + "|Jane Doe|jane@example.com|2024-03-05T10:00:00+00:00|Add app";
            }
        });

        // Act
        GitHistory history = collector.collect(REPOSITORY, WINDOW);

        // Assert
        assertEquals(1, history.getCommits().size());
        assertEquals("Add app", history.getCommits().get(0).getSubject());
        assertEquals(1, history.getCommitStats().size());
        assertEquals(4, history.getCommitStats().get(0).getTotalChanges());
        assertEquals(List.of(HASH), history.getFileChanges().get("src/App.java"));
        assertEquals(2, history.getContributors().get(0).getCommitCount());
        assertEquals(2, history.getTags().size());
        assertFalse(history.getTags().get(1).isDated());
        assertEquals(List.of("main", "develop"), history.getBranches());
    }

    @Test
    void testCollect_boundsLogQueriesByWindow() throws Exception {
        when(executor.execute(eq(PATH), anyList())).thenReturn("");

        collector.collect(REPOSITORY, WINDOW);

        verify(executor, times(4)).execute(eq(PATH), argThat(arguments ->
                arguments.contains("--since=2024-03-01T00:00:00Z") && arguments.contains("--until=2024-03-31T00:00:00Z")));
        verify(executor).execute(eq(PATH), argThat(arguments -> arguments.get(0).equals("tag")));
    }

    @Test
    void testCollect_failedQueriesYieldEmptyHistory() throws Exception {
        when(executor.execute(eq(PATH), anyList())).thenThrow(new GitCommandException("not a git repository", 128));

        GitHistory history = collector.collect(REPOSITORY, WINDOW);

        assertEquals(GitHistory.empty(), history);
        verify(executor, times(6)).execute(eq(PATH), anyList());
    }
}
