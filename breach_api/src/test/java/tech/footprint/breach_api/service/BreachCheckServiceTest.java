package tech.footprint.breach_api.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import tech.footprint.breach_api.model.BreachSource;
import tech.footprint.breach_api.model.EmailCheckResponse;
import tech.footprint.breach_api.repository.BreachSourceRepository;
import tech.footprint.breach_api.repository.BreachedEmailRepository;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BreachCheckServiceTest {

    private static final String HASH = "06a240d11cc201676da976f7b49341181fd180da37cbe40a77432c0a366c80c3";

    @Mock
    private BreachedEmailRepository breachedEmailRepository;
    @Mock
    private BreachSourceRepository breachSourceRepository;
    @Mock
    private ScanLogService scanLogService;

    @InjectMocks
    private BreachCheckService service;

    @Test
    @DisplayName("Breaches found for the normalized hash are returned as entries")
    void found() {
        // given
        BreachSource adobe = BreachSource.builder()
                .name("Adobe")
                .domain("adobe.com")
                .breachDate(LocalDate.of(2013, 10, 4))
                .dataClasses(List.of("Email addresses", "Passwords"))
                .pwnCount(152_445_165L)
                .build();
        when(breachedEmailRepository.findSourcesByEmailHash(HASH)).thenReturn(List.of(adobe));
        when(breachSourceRepository.count()).thenReturn(15L);

        // when
        EmailCheckResponse response = service.checkEmail("John.Doe+x@gmail.com", "10.0.0.1");

        // then
        assertThat(response.isFound()).isTrue();
        assertThat(response.isSourceAvailable()).isTrue();
        assertThat(response.getCheckedSources()).isEqualTo(15L);
        assertThat(response.getEntries()).singleElement().satisfies(entry -> {
            assertThat(entry.getName()).isEqualTo("Adobe");
            assertThat(entry.getBreachDate()).isEqualTo("2013-10-04");
            assertThat(entry.getDataClasses()).contains("Passwords");
            assertThat(entry.getPwnCount()).isEqualTo(152_445_165L);
        });
        verify(scanLogService).recordLookup("email", HASH, true, "10.0.0.1");
    }

    @Test
    @DisplayName("A clean email answers found=false with the source available")
    void clean() {
        when(breachedEmailRepository.findSourcesByEmailHash(anyString())).thenReturn(List.of());
        when(breachSourceRepository.count()).thenReturn(3L);

        EmailCheckResponse response = service.checkEmail("nobody@example.com", null);

        assertThat(response.isFound()).isFalse();
        assertThat(response.getEntries()).isEmpty();
        assertThat(response.isSourceAvailable()).isTrue();
        verify(scanLogService).recordLookup(eq("email"), anyString(), eq(false), isNull());
    }

    @Test
    @DisplayName("Database failures propagate instead of reading as a clean result")
    void databaseFailure() {
        when(breachedEmailRepository.findSourcesByEmailHash(anyString()))
                .thenThrow(new DataAccessResourceFailureException("down"));

        assertThatThrownBy(() -> service.checkEmail("a@b.com", null))
                .isInstanceOf(DataAccessResourceFailureException.class);
        verifyNoInteractions(scanLogService);
    }
}
