package io.github.riemr.trainer.presentation.controller;

import io.github.riemr.trainer.optimization.service.OptimalScheduleService;
import io.github.riemr.trainer.optimization.solution.ScheduleResult;
import io.github.riemr.trainer.presentation.form.OptimalScheduleForm;
import io.github.riemr.trainer.presentation.form.SchedulingPreferencesForm;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/trainers")
@RequiredArgsConstructor
@Slf4j
public class OptimalScheduleController {

    private final OptimalScheduleService optimalScheduleService;

    @PostMapping(path = "/{trainerId}/optimal-schedule", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> generate(@PathVariable Long trainerId, @Valid @RequestBody OptimalScheduleForm form) {
        if (form.getStartDate() != null && form.getEndDate() != null && form.getEndDate().isBefore(form.getStartDate())) {
            return ResponseEntity.badRequest().body(Map.of("error", "endDate must not be before startDate"));
        }
        SchedulingPreferencesForm prefs = form.getPreferences();
        if (prefs != null) {
            if (!prefs.isWorkHoursValid()) {
                return ResponseEntity.badRequest().body(Map.of("error", "Work end time must be after work start time"));
            }
            if (prefs.isAllDaysOff()) {
                return ResponseEntity.badRequest().body(Map.of("error", "Cannot have all days as days off"));
            }
        }
        log.debug("Optimal schedule requested for trainer {} ({} requests)", trainerId,
                form.getRequests() == null ? 0 : form.getRequests().size());
        ScheduleResult result = optimalScheduleService.generate(form.toProblem(trainerId));
        return ResponseEntity.ok(result);
    }
}
