package com.questionbank.interfaces.api.latex;

import com.questionbank.application.auth.CurrentUserProvider;
import com.questionbank.application.latex.LatexAppService;
import com.questionbank.domain.latex.model.RepairResult;
import com.questionbank.interfaces.api.dto.LatexFixResponse;
import com.questionbank.interfaces.api.dto.LatexStatsResponse;
import com.questionbank.interfaces.api.dto.LatexTextRequest;
import com.questionbank.interfaces.api.dto.LatexValidationResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/latex")
@RequiredArgsConstructor
public class LatexController {

    private final LatexAppService latexAppService;
    private final CurrentUserProvider currentUserProvider;

    @PostMapping("/quick-fix")
    public ResponseEntity<LatexFixResponse> quickFix(@Valid @RequestBody LatexTextRequest request) {
        String userId = currentUserProvider.requireUserId();

        RepairResult result = latexAppService.quickFix(request.text(), userId);

        return ResponseEntity.ok(new LatexFixResponse(true, result.text()));
    }

    @PostMapping("/normalize")
    public ResponseEntity<LatexFixResponse> normalize(@Valid @RequestBody LatexTextRequest request) {
        String userId = currentUserProvider.requireUserId();

        return ResponseEntity.ok(new LatexFixResponse(true, latexAppService.normalize(request.text(), userId)));
    }

    @PostMapping("/validate")
    public ResponseEntity<LatexValidationResponse> validate(@Valid @RequestBody LatexTextRequest request) {
        currentUserProvider.requireUserId();

        return ResponseEntity.ok(LatexValidationResponse.from(latexAppService.validate(request.text())));
    }

    @PostMapping("/stats")
    public ResponseEntity<LatexStatsResponse> stats(@Valid @RequestBody LatexTextRequest request) {
        currentUserProvider.requireUserId();

        return ResponseEntity.ok(LatexStatsResponse.from(latexAppService.stats(request.text())));
    }
}
