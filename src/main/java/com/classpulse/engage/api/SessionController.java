package com.classpulse.engage.api;

import com.classpulse.engage.session.SessionModels.Dashboard;
import com.classpulse.engage.session.SessionModels.SessionView;
import com.classpulse.engage.session.SessionModels.SubmissionItem;
import com.classpulse.engage.session.SessionService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/sessions")
public class SessionController {
    private final SessionService sessionService;

    public SessionController(SessionService sessionService) {
        this.sessionService = sessionService;
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<SessionView> get(@PathVariable String sessionId) {
        return ResponseEntity.ok(sessionService.view(sessionService.get(sessionId)));
    }

    @PostMapping("/{sessionId}/close")
    public ResponseEntity<SessionView> close(@PathVariable String sessionId) {
        return ResponseEntity.ok(sessionService.view(sessionService.close(sessionId)));
    }

    @GetMapping("/{sessionId}/submissions")
    public ResponseEntity<List<SubmissionItem>> submissions(@PathVariable String sessionId) {
        return ResponseEntity.ok(sessionService.submissions(sessionId));
    }

    @GetMapping("/{sessionId}/dashboard")
    public ResponseEntity<Dashboard> dashboard(@PathVariable String sessionId) {
        return ResponseEntity.ok(sessionService.dashboard(sessionId));
    }
}
