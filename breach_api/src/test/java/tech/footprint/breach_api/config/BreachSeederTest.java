package tech.footprint.breach_api.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.footprint.breach_api.model.BreachImportRequest;
import tech.footprint.breach_api.repository.BreachSourceRepository;
import tech.footprint.breach_api.service.BreachImportService;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BreachSeederTest {

    @Mock
    private BreachSourceRepository breachSourceRepository;
    @Mock
    private BreachImportService breachImportService;

    private BreachSeeder seeder;

    @BeforeEach
    void setUp() {
        seeder = new BreachSeeder(breachSourceRepository, breachImportService,
                new ObjectMapper().registerModule(new JavaTimeModule()));
    }

    @Test
    @DisplayName("An empty cache is seeded with the catalogue metadata, no emails")
    void seedsEmptyCache() throws Exception {
        when(breachSourceRepository.count()).thenReturn(0L);

        seeder.run();

        ArgumentCaptor<BreachImportRequest> captor = ArgumentCaptor.forClass(BreachImportRequest.class);
        verify(breachImportService, times(15)).importBreach(captor.capture());
        assertThat(captor.getAllValues()).allSatisfy(request -> {
            assertThat(request.getName()).isNotBlank();
            assertThat(request.getEmails()).isNull();
        });
        assertThat(captor.getAllValues())
                .filteredOn(r -> r.getName().equals("Adobe"))
                .singleElement()
                .satisfies(r -> assertThat(r.getBreachDate()).isEqualTo(LocalDate.of(2013, 10, 4)));
    }

    @Test
    @DisplayName("A populated cache is left alone")
    void skipsPopulatedCache() throws Exception {
        when(breachSourceRepository.count()).thenReturn(3L);

        seeder.run();

        verifyNoInteractions(breachImportService);
    }
}
