package com.tony.powerRank.service;

import com.tony.powerRank.model.Game;
import com.tony.powerRank.model.Team;
import com.tony.powerRank.repository.GameRepository;
import com.tony.powerRank.repository.TeamRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.StringReader;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GameImportServiceTest {

    private static final String HEADER = "game_uid,game_date,provider,home_team_id,home_team_name,home_club,home_state,"
            + "home_age,home_gender,away_team_id,away_team_name,away_club,away_state,away_age,away_gender,"
            + "home_score,away_score\n";

    @Mock
    private TeamRepository teamRepository;

    @Mock
    private GameRepository gameRepository;

    @InjectMocks
    private GameImportService importService;

    @Captor
    private ArgumentCaptor<Collection<Game>> gamesCaptor;

    @Captor
    private ArgumentCaptor<Collection<Team>> teamsCaptor;

    @Test
    @DisplayName("Devrait créer les matchs et équipes inconnus et ignorer les lignes invalides")
    void shouldImportNewGames() {
        // ARRANGE
        String csv = HEADER
                + "g1,2025-05-01,gotsport,t1,Lions,FC Lions,ca,14,Male,t2,Tigers,,NV,14,male,3,1\n"
                + "g2,2025-05-02,gotsport,t2,Tigers,,NV,14,male,t3,Bears,,CA,14,male,,\n"
                + ",2025-05-03,gotsport,t1,Lions,,CA,14,male,t3,Bears,,CA,14,male,1,1\n"
                + "g4,2025-05-04,gotsport,t1,Lions,,CA,14,male,t1,Lions,,CA,14,male,1,1\n";
        when(teamRepository.findByIdIn(anyList())).thenReturn(List.of());
        when(gameRepository.findByGameUidIn(anyList())).thenReturn(List.of());

        // ACT
        String report = importService.importGames(new StringReader(csv));

        // ASSERT
        assertThat(report).contains("2 nouveaux").contains("0 maj").contains("2 ignorés");

        verify(gameRepository).saveAll(gamesCaptor.capture());
        List<Game> games = new ArrayList<>(gamesCaptor.getValue());
        assertThat(games).extracting(Game::getGameUid).containsExactly("g1", "g2");
        assertThat(games.get(0).getHomeScore()).isEqualTo(3);
        assertThat(games.get(0).getGameDate()).isEqualTo(LocalDate.of(2025, 5, 1));
        assertThat(games.get(0).getProvider()).isEqualTo("gotsport");
        assertThat(games.get(1).isPlayed()).isFalse();

        verify(teamRepository).saveAll(teamsCaptor.capture());
        List<Team> teams = new ArrayList<>(teamsCaptor.getValue());
        assertThat(teams).extracting(Team::getId).containsExactly("t1", "t2", "t3");
        assertThat(teams.get(0).getGender()).isEqualTo("male");
        assertThat(teams.get(0).getStateCode()).isEqualTo("CA");
        assertThat(teams.get(0).getClub()).isEqualTo("FC Lions");
    }

    @Test
    @DisplayName("Devrait mettre à jour un match existant dont le score est arrivé")
    void shouldUpdateExistingGame() {
        // ARRANGE
        Team lions = new Team("t1", "Lions", 14, "male");
        lions.setStateCode("CA");
        Team tigers = new Team("t2", "Tigers", 14, "male");
        tigers.setStateCode("NV");
        Game existing = new Game("g1", lions, tigers, LocalDate.of(2025, 5, 1));
        when(teamRepository.findByIdIn(anyList())).thenReturn(List.of(lions, tigers));
        when(gameRepository.findByGameUidIn(anyList())).thenReturn(List.of(existing));
        String csv = HEADER + "g1,2025-05-01,gotsport,t1,Lions,,CA,14,male,t2,Tigers,,NV,14,male,2,2\n";

        // ACT
        String report = importService.importGames(new StringReader(csv));

        // ASSERT
        assertThat(report).contains("0 nouveaux").contains("1 maj");
        assertThat(existing.getHomeScore()).isEqualTo(2);
        assertThat(existing.getAwayScore()).isEqualTo(2);
    }

    @Test
    @DisplayName("Devrait ne rien réécrire quand la ligne est identique")
    void shouldSkipUnchangedGame() {
        // ARRANGE
        Team lions = new Team("t1", "Lions", 14, "male");
        Team tigers = new Team("t2", "Tigers", 14, "male");
        Game existing = new Game("g1", lions, tigers, LocalDate.of(2025, 5, 1));
        existing.setHomeScore(1);
        existing.setAwayScore(0);
        when(teamRepository.findByIdIn(anyList())).thenReturn(List.of(lions, tigers));
        when(gameRepository.findByGameUidIn(anyList())).thenReturn(List.of(existing));
        String csv = HEADER + "g1,2025-05-01,gotsport,t1,Lions,,,14,male,t2,Tigers,,,14,male,1,0\n";

        // ACT
        String report = importService.importGames(new StringReader(csv));

        // ASSERT
        assertThat(report).contains("1 inchangés");
        verify(gameRepository).saveAll(gamesCaptor.capture());
        assertThat(gamesCaptor.getValue()).isEmpty();
    }
}
