package com.stacker.indexer;

import com.stacker.projector.CompanyDirectory;
import com.stacker.search.StackerIndex;
import com.stacker.task.IndexTask;
import com.stacker.task.IndexTaskPublisher;
import com.stacker.task.IndexTaskType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IndexAdminTest {

    @Mock
    private StackerIndex index;

    @Mock
    private CompanyDirectory companyDirectory;

    @Mock
    private IndexTaskPublisher publisher;

    private IndexAdmin admin;

    @BeforeEach
    void setUp() {
        admin = new IndexAdmin(index, companyDirectory, publisher);
    }

    @Test
    void createAndDelete() throws IOException {
        admin.run(List.of("create"));
        admin.run(List.of("delete"));

        verify(index).create();
        verify(index).delete();
    }

    @Test
    void populateNamedCompanies() throws IOException {
        admin.run(List.of("populate", "3", "8"));

        IndexTask task = published();
        assertEquals(IndexTaskType.POPULATE, task.getType());
        assertEquals(List.of(3, 8), task.getCompanyIds());
        verifyNoInteractions(companyDirectory);
    }

    @Test
    void populateDefaultsToActiveCompanies() throws IOException {
        when(companyDirectory.activeCompanyIds()).thenReturn(List.of(1, 2));

        admin.run(List.of("populate"));

        assertEquals(List.of(1, 2), published().getCompanyIds());
    }

    @Test
    void nothingIsPublishedWithoutCompanies() throws IOException {
        when(companyDirectory.activeCompanyIds()).thenReturn(List.of());

        admin.run(List.of("populate"));

        verifyNoInteractions(publisher);
    }

    @Test
    void unknownCommandsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> admin.run(List.of()));
        assertThrows(IllegalArgumentException.class, () -> admin.run(List.of("reindex")));
        assertThrows(NumberFormatException.class, () -> admin.run(List.of("populate", "acme")));
    }

    private IndexTask published() {
        ArgumentCaptor<IndexTask> task = ArgumentCaptor.forClass(IndexTask.class);
        verify(publisher).publish(task.capture());
        return task.getValue();
    }
}
