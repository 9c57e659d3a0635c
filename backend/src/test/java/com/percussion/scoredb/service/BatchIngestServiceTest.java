package com.percussion.scoredb.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.percussion.scoredb.dto.BatchIngestSummary;
import com.percussion.scoredb.dto.ImportRunSummaryDTO;
import com.percussion.scoredb.ingest.SheetFormatException;
import com.percussion.scoredb.model.ImportRun;
import com.percussion.scoredb.repository.ImportRunRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BatchIngestServiceTest {

    @Mock private ScoreSheetIngestService ingestService;
    @Mock private ImportRunRepository importRunRepository;

    @TempDir Path tempDir;

    private BatchIngestService service;

    @BeforeEach
    void setUp() {
        service = new BatchIngestService(ingestService, importRunRepository, new ObjectMapper());
        lenient().when(importRunRepository.save(any(ImportRun.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private static IngestResult ok(long showId, int created) {
        return new IngestResult(showId, "Arcadia HS Saturday", LocalDate.of(2024, 9, 14), 1, 1, created, 0);
    }

    @Test
    void ingestFolder_processesSheetsInNameOrder_andContinuesPastFailures() throws Exception {
        Path folder = Files.createDirectory(tempDir.resolve("sheets"));
        Path b = Files.writeString(folder.resolve("b.pdf"), "b");
        Path a = Files.writeString(folder.resolve("a.PDF"), "a");
        Path c = Files.writeString(folder.resolve("c.pdf"), "c");
        Files.writeString(folder.resolve("notes.txt"), "skip me");

        when(ingestService.ingest(a)).thenReturn(ok(1L, 4));
        when(ingestService.ingest(b)).thenThrow(new SheetFormatException("No weekday in file name: 'b.pdf'"));
        when(ingestService.ingest(c)).thenReturn(ok(2L, 6));

        BatchIngestSummary summary = service.ingestFolder(folder);

        InOrder order = inOrder(ingestService);
        order.verify(ingestService).ingest(a);
        order.verify(ingestService).ingest(b);
        order.verify(ingestService).ingest(c);
        verifyNoMoreInteractions(ingestService);

        assertThat(summary.filesTotal()).isEqualTo(3);
        assertThat(summary.filesSucceeded()).isEqualTo(2);
        assertThat(summary.filesFailed()).isEqualTo(1);
        assertThat(summary.runs()).extracting(ImportRunSummaryDTO::getStatus)
                .containsExactly(ImportRun.COMPLETED, ImportRun.FAILED, ImportRun.COMPLETED);
        assertThat(summary.runs().get(1).getReason()).startsWith("SheetFormatException").contains("No weekday");
        assertThat(summary.runs().get(2).getPerformancesCreated()).isEqualTo(6);
        assertThat(summary.runs().get(2).getShowId()).isEqualTo(2L);
    }

    @Test
    void ingestFolder_rejectsMissingDirectory() {
        assertThatThrownBy(() -> service.ingestFolder(tempDir.resolve("nope")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Not a directory");
        verifyNoInteractions(ingestService);
    }

    @Test
    void ingestUpload_storesUnderOriginalName_andRecordsRun() throws Exception {
        ReflectionTestUtils.setField(service, "importsDir", tempDir.resolve("imports").toString());
        String name = "2024_09_14_arcadia_hs_saturday_arcadia_ca.pdf";
        MockMultipartFile file = new MockMultipartFile("file", name, "application/pdf", new byte[]{1, 2, 3});
        Path stored = tempDir.resolve("imports").resolve(name);
        when(ingestService.ingest(stored)).thenReturn(ok(7L, 3));

        ImportRun run = service.ingestUpload(file);

        assertThat(stored).exists().hasBinaryContent(new byte[]{1, 2, 3});
        assertThat(run.getStatus()).isEqualTo(ImportRun.COMPLETED);
        assertThat(run.getSourceType()).isEqualTo(BatchIngestService.SOURCE_UPLOAD);
        assertThat(run.getFilename()).isEqualTo(name);
        assertThat(run.getShowId()).isEqualTo(7L);
        assertThat(run.getParams()).contains("\"sourceType\":\"UPLOAD\"");
        assertThat(run.getFinishedAt()).isNotNull();
    }

    @Test
    void ingestUpload_rejectsDotNamesAndOtherExtensions() {
        Path imports = tempDir.resolve("imports");
        ReflectionTestUtils.setField(service, "importsDir", imports.toString());

        for (String name : new String[]{"..", ".", "notes.txt", "../2024_09_14_arcadia_hs_saturday_arcadia_ca"}) {
            MockMultipartFile file = new MockMultipartFile("file", name, "application/pdf", new byte[]{1});
            assertThatThrownBy(() -> service.ingestUpload(file))
                    .as(name)
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining(".pdf file");
        }

        assertThat(imports).doesNotExist();
        verifyNoInteractions(ingestService, importRunRepository);
    }

    @Test
    void ingestFile_failureIsRecordedNotThrown() throws Exception {
        Path sheet = Files.writeString(tempDir.resolve("x.pdf"), "x");
        when(ingestService.ingest(sheet)).thenThrow(new IllegalStateException("boom"));

        ImportRun run = service.ingestFile(sheet, BatchIngestService.SOURCE_FOLDER);

        assertThat(run.getStatus()).isEqualTo(ImportRun.FAILED);
        assertThat(run.getReason()).isEqualTo("IllegalStateException: boom");
        verify(importRunRepository, times(2)).save(run);
    }
}
