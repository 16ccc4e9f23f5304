package tech.footprint.breach_api.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import tech.footprint.breach_api.model.ScanLog;
import tech.footprint.breach_api.repository.ScanLogRepository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScanLogServiceTest {

    @Mock
    private ScanLogRepository scanLogRepository;

    @InjectMocks
    private ScanLogService service;

    @Test
    @DisplayName("Only a hash prefix and a hashed address are stored")
    void storesPrefixes() {
        service.recordLookup("email", "973dfe463ec85785f5f95af5ba3906eedb2d931c24e69824a89ea65dba4e813b", true, "10.0.0.1").join();

        ArgumentCaptor<ScanLog> captor = ArgumentCaptor.forClass(ScanLog.class);
        verify(scanLogRepository).save(captor.capture());
        ScanLog saved = captor.getValue();
        assertThat(saved.getInputType()).isEqualTo("email");
        assertThat(saved.getInputHashPrefix()).isEqualTo("973dfe46");
        assertThat(saved.isResultFound()).isTrue();
        assertThat(saved.getIpHash()).isEqualTo(Hashes.sha256("10.0.0.1")).doesNotContain("10.0.0.1");
    }

    @Test
    @DisplayName("Logging failures never reach the caller")
    void swallowsStorageErrors() {
        when(scanLogRepository.save(any())).thenThrow(new DataAccessResourceFailureException("down"));

        assertThat(service.recordLookup("password", "5BAA6", false, null)).isCompleted();
    }
}
