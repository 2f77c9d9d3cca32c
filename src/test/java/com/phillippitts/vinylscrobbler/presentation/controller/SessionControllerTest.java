package com.phillippitts.vinylscrobbler.presentation.controller;

import com.phillippitts.vinylscrobbler.domain.Activity;
import com.phillippitts.vinylscrobbler.domain.DebugInfo;
import com.phillippitts.vinylscrobbler.domain.SessionStatus;
import com.phillippitts.vinylscrobbler.domain.Track;
import com.phillippitts.vinylscrobbler.exception.AudioDeviceException;
import com.phillippitts.vinylscrobbler.exception.SessionStartException;
import com.phillippitts.vinylscrobbler.service.audio.capture.AudioDevice;
import com.phillippitts.vinylscrobbler.service.audio.capture.AudioDeviceCatalog;
import com.phillippitts.vinylscrobbler.service.session.SessionManager;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SessionController.class)
class SessionControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private SessionManager sessionManager;

    @MockBean
    private AudioDeviceCatalog catalog;

    @Test
    void listsInputDevices() throws Exception {
        when(catalog.listInputDevices()).thenReturn(List.of(
                new AudioDevice(0, "Built-in Microphone", 1),
                new AudioDevice(1, "USB Audio CODEC", 2)));

        mvc.perform(get("/devices"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[1].index").value(1))
                .andExpect(jsonPath("$[1].name").value("USB Audio CODEC"))
                .andExpect(jsonPath("$[1].channels").value(2));
    }

    @Test
    void deviceEnumerationFailureReturns503() throws Exception {
        when(catalog.listInputDevices()).thenThrow(new AudioDeviceException(
                AudioDeviceException.Reason.UNAVAILABLE, null, "Audio system unavailable"));

        mvc.perform(get("/devices"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.errorCode").value("AudioDeviceException"));
    }

    @Test
    void idleStatusHasNoTrack() throws Exception {
        when(sessionManager.status()).thenReturn(SessionStatus.idle());

        mvc.perform(get("/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.running").value(false))
                .andExpect(jsonPath("$.currentTrack").value(nullValue()))
                .andExpect(jsonPath("$.activity").value("STANDBY"))
                .andExpect(jsonPath("$.debug.detectionCount").value(0));
    }

    @Test
    void runningStatusShowsTrackAndDiagnostics() throws Exception {
        Instant at = Instant.parse("2024-05-01T20:15:00Z");
        DebugInfo debug = DebugInfo.empty().withAudioLevel(0.42).withDetectionStarted(at);
        when(sessionManager.status()).thenReturn(new SessionStatus(true, 1,
                new Track("Can", "Vitamin C", 0.93, at), Activity.ACTIVE, debug));

        mvc.perform(get("/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.running").value(true))
                .andExpect(jsonPath("$.deviceIndex").value(1))
                .andExpect(jsonPath("$.currentTrack.artist").value("Can"))
                .andExpect(jsonPath("$.currentTrack.title").value("Vitamin C"))
                .andExpect(jsonPath("$.activity").value("ACTIVE"))
                .andExpect(jsonPath("$.debug.audioLevel").value(0.42))
                .andExpect(jsonPath("$.debug.detectionCount").value(1));
    }

    @Test
    void startWithDeviceIndex() throws Exception {
        when(sessionManager.start(2)).thenReturn(true);

        mvc.perform(post("/start").contentType(MediaType.APPLICATION_JSON).content("{\"device_index\": 2}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("started"));

        verify(sessionManager).start(2);
    }

    @Test
    void startAcceptsCamelCaseField() throws Exception {
        when(sessionManager.start(3)).thenReturn(true);

        mvc.perform(post("/start").contentType(MediaType.APPLICATION_JSON).content("{\"deviceIndex\": 3}"))
                .andExpect(status().isOk());

        verify(sessionManager).start(3);
    }

    @Test
    void startWithoutBodyLetsManagerPickDevice() throws Exception {
        when(sessionManager.start(null)).thenReturn(true);

        mvc.perform(post("/start"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("started"));

        verify(sessionManager).start(null);
    }

    @Test
    void startWhileRunningReportsAlreadyRunning() throws Exception {
        when(sessionManager.start(any())).thenReturn(false);

        mvc.perform(post("/start").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("already_running"));
    }

    @Test
    void startThatCannotBeScheduledReturns503() throws Exception {
        when(sessionManager.start(any())).thenThrow(new SessionStartException("Could not schedule session loop"));

        mvc.perform(post("/start"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.errorCode").value("SessionStartException"))
                .andExpect(jsonPath("$.details").value("Could not schedule session loop"));
    }

    @Test
    void malformedStartBodyReturns400() throws Exception {
        mvc.perform(post("/start").contentType(MediaType.APPLICATION_JSON).content("{device_index"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("InvalidRequest"));

        verify(sessionManager, never()).start(any());
    }

    @Test
    void stopReportsWhetherSessionWasRunning() throws Exception {
        when(sessionManager.stop()).thenReturn(true, false);

        mvc.perform(post("/stop"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("stopped"));
        mvc.perform(post("/stop"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("not_running"));
    }

    @Test
    void echoesRequestIdHeader() throws Exception {
        when(sessionManager.status()).thenReturn(SessionStatus.idle());

        mvc.perform(get("/status").header("X-Request-ID", "abc123"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Request-ID", "abc123"));
    }
}
