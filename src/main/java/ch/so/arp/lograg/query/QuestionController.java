package ch.so.arp.lograg.query;

import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import jakarta.validation.Valid;

/**
 * REST endpoint answering questions about the ingested logs.
 */
@RestController
@RequestMapping(path = "/api/questions", produces = MediaType.APPLICATION_JSON_VALUE)
@Validated
public class QuestionController {

    private final QueryService queryService;

    public QuestionController(QueryService queryService) {
        this.queryService = queryService;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public Answer ask(@Valid @RequestBody QuestionRequest request) {
        return queryService.ask(request.question(), request.k(), request.threshold(), request.history());
    }
}
