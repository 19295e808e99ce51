package com.wyzinc.pricewatch.service;

import static org.assertj.core.api.Assertions.*;

import com.wyzinc.pricewatch.domain.AuthStatus;
import com.wyzinc.pricewatch.domain.LoginSettings;
import org.junit.jupiter.api.Test;

import java.util.List;

class MarkerAuthVerifierTest {

    @Test
    void testDefaultMarkersAreCaseInsensitive() {
        // Given
        MarkerAuthVerifier verifier = MarkerAuthVerifier.from(LoginSettings.builder().build());

        // When/Then
        assertThat(verifier.verify("<a href=\"/account\">Minha Conta</a>")).isEqualTo(AuthStatus.CONFIRMED);
        assertThat(verifier.verify("<button>LOGOUT</button>")).isEqualTo(AuthStatus.CONFIRMED);
        assertThat(verifier.verify("<form><input name=\"password\"></form>")).isEqualTo(AuthStatus.UNCONFIRMED);
        assertThat(verifier.verify(null)).isEqualTo(AuthStatus.UNCONFIRMED);
    }

    @Test
    void testFailureMarkerWins() {
        // Given
        MarkerAuthVerifier verifier = new MarkerAuthVerifier(List.of("sair"), List.of("Palavra-passe incorreta"));

        // When
        AuthStatus status = verifier.verify("<p>palavra-passe incorreta</p><a>Sair</a>");

        // Then
        assertThat(status).isEqualTo(AuthStatus.FAILED);
    }

    @Test
    void testBlankMarkersAreIgnored() {
        // Given
        MarkerAuthVerifier verifier = new MarkerAuthVerifier(List.of("logout"), List.of(" "));

        // When/Then
        assertThat(verifier.verify("<a>logout</a>")).isEqualTo(AuthStatus.CONFIRMED);
    }
}
