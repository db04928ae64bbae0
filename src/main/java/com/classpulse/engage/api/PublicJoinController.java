package com.classpulse.engage.api;

import com.classpulse.engage.session.SessionModels.JoinView;
import com.classpulse.engage.session.SessionService;
import com.classpulse.engage.submission.SubmissionModels.SubmissionCommand;
import com.classpulse.engage.submission.SubmissionModels.SubmissionResult;
import com.classpulse.engage.submission.SubmissionService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/** Participant-facing endpoints, addressed by join token rather than session id. */
@RestController
@RequestMapping("/api/public/join")
public class PublicJoinController {
    private final SessionService sessionService;
    private final SubmissionService submissionService;

    public PublicJoinController(SessionService sessionService, SubmissionService submissionService) {
        this.sessionService = sessionService;
        this.submissionService = submissionService;
    }

    @GetMapping("/{token}")
    public ResponseEntity<JoinView> join(@PathVariable String token) {
        return ResponseEntity.ok(sessionService.joinByToken(token));
    }

    @PostMapping("/{token}/submit")
    public ResponseEntity<SubmissionResult> submit(@PathVariable String token, @Valid @RequestBody SubmitRequest request) {
        return ResponseEntity.ok(submissionService.submit(token, new SubmissionCommand(
                request.studentId(), request.guestId(), request.guestName(), request.mood(), request.answers())));
    }

    public record SubmitRequest(String studentId,
                                String guestId,
                                String guestName,
                                @NotBlank String mood,
                                Map<String, String> answers) {}
}
