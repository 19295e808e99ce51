package com.wyzinc.pricewatch.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class LoginSettings {
    public static final List<String> DEFAULT_SUCCESS_MARKERS = List.of("minha conta", "logout", "sair");

    @JsonProperty("login_page")
    String loginPage;

    @JsonProperty("post_url")
    String postUrl;

    @JsonProperty("user_field")
    String userField;

    @JsonProperty("pass_field")
    String passField;

    @JsonProperty("success_markers")
    List<String> successMarkers;

    @JsonProperty("failure_markers")
    List<String> failureMarkers;

    public List<String> getSuccessMarkers() {
        return successMarkers == null || successMarkers.isEmpty() ? DEFAULT_SUCCESS_MARKERS : successMarkers;
    }

    public List<String> getFailureMarkers() {
        return failureMarkers == null ? List.of() : failureMarkers;
    }
}
