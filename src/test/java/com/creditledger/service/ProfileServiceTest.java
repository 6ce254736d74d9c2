package com.creditledger.service;

import com.creditledger.model.BorrowerProfile;
import com.creditledger.model.RiskCategory;
import com.creditledger.repository.BorrowerProfileRepository;
import com.creditledger.result.LendingError;
import com.creditledger.result.LendingResult;
import com.creditledger.security.Caller;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ProfileService Unit Tests")
class ProfileServiceTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    @Mock
    private BorrowerProfileRepository profileRepository;

    @Mock
    private LedgerStatsService ledgerStatsService;

    private ProfileService profileService;

    private final Caller alice = Caller.borrower("alice");

    @BeforeEach
    void setUp() {
        profileService = new ProfileService(profileRepository, ledgerStatsService,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should register a new profile with a derived risk category")
    void shouldRegisterProfile() {
        when(profileRepository.findById("alice")).thenReturn(Optional.empty());
        when(profileRepository.save(any(BorrowerProfile.class))).thenAnswer(inv -> inv.getArgument(0));

        LendingResult<BorrowerProfile> result = profileService.registerProfile(alice,
                new ProfileCommand(720, 100_000, 20_000, 5, 0, 18, 20));

        assertThat(result.isOk()).isTrue();
        BorrowerProfile profile = result.value();
        assertThat(profile.getBorrower()).isEqualTo("alice");
        assertThat(profile.getRiskCategory()).isEqualTo(RiskCategory.LOW);
        assertThat(profile.getLastUpdated()).isEqualTo(NOW);
        verify(ledgerStatsService).acquireLedgerLock();
    }

    @Test
    @DisplayName("Should recompute risk category when a profile is updated")
    void shouldRecomputeCategoryOnUpdate() {
        BorrowerProfile existing = new BorrowerProfile();
        existing.setBorrower("alice");
        existing.setCreditScore(720);
        existing.setRiskCategory(RiskCategory.LOW);
        when(profileRepository.findById("alice")).thenReturn(Optional.of(existing));
        when(profileRepository.save(any(BorrowerProfile.class))).thenAnswer(inv -> inv.getArgument(0));

        LendingResult<BorrowerProfile> result = profileService.registerProfile(alice,
                new ProfileCommand(650, 50_000, 10_000, 2, 1, 3, 4));

        assertThat(result.value()).isSameAs(existing);
        assertThat(existing.getCreditScore()).isEqualTo(650);
        assertThat(existing.getRiskCategory()).isEqualTo(RiskCategory.MEDIUM);
    }

    @Test
    @DisplayName("Should reject credit scores outside 300-850 without writing")
    void shouldRejectOutOfRangeScore() {
        LendingResult<BorrowerProfile> low = profileService.registerProfile(alice,
                new ProfileCommand(299, 100_000, 0, 0, 0, 0, 0));
        LendingResult<BorrowerProfile> high = profileService.registerProfile(alice,
                new ProfileCommand(851, 100_000, 0, 0, 0, 0, 0));

        assertThat(low.error()).isEqualTo(LendingError.INVALID_PARAMETERS);
        assertThat(high.error()).isEqualTo(LendingError.INVALID_PARAMETERS);
        verify(profileRepository, never()).save(any());
    }

    @Test
    @DisplayName("Should reject negative amounts and counters")
    void shouldRejectNegativeValues() {
        assertThat(profileService.registerProfile(alice,
                new ProfileCommand(700, -1, 0, 0, 0, 0, 0)).error())
                .isEqualTo(LendingError.INVALID_PARAMETERS);
        assertThat(profileService.registerProfile(alice,
                new ProfileCommand(700, 0, 0, 0, -1, 0, 0)).error())
                .isEqualTo(LendingError.INVALID_PARAMETERS);
        verify(profileRepository, never()).save(any());
    }

    @Test
    @DisplayName("Should accept boundary credit scores")
    void shouldAcceptBoundaryScores() {
        when(profileRepository.findById("alice")).thenReturn(Optional.empty());
        when(profileRepository.save(any(BorrowerProfile.class))).thenAnswer(inv -> inv.getArgument(0));

        assertThat(profileService.registerProfile(alice,
                new ProfileCommand(300, 0, 0, 0, 0, 0, 0)).value().getRiskCategory())
                .isEqualTo(RiskCategory.VERY_HIGH);
        assertThat(profileService.registerProfile(alice,
                new ProfileCommand(850, 0, 0, 0, 0, 0, 0)).value().getRiskCategory())
                .isEqualTo(RiskCategory.LOW);
    }
}
