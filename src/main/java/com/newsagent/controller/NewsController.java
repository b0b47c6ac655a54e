package com.newsagent.controller;

import com.newsagent.model.Article;
import com.newsagent.model.HeadlinesResponse;
import com.newsagent.model.NewsSearchRequest;
import com.newsagent.model.NewsSearchResponse;
import com.newsagent.service.HeadlineService;
import com.newsagent.service.PineconeService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/news")
public class NewsController {

    private final PineconeService pineconeService;
    private final HeadlineService headlineService;

    public NewsController(PineconeService pineconeService, HeadlineService headlineService) {
        this.pineconeService = pineconeService;
        this.headlineService = headlineService;
    }

    @PostMapping("/search")
    public NewsSearchResponse search(@Valid @RequestBody NewsSearchRequest request) {
        List<Article> results = pineconeService.searchSimilar(request.query(), request.limitOrDefault(), null).stream()
                .map(match -> Article.fromVectorFields(match.id(), match.fields()))
                .toList();
        return new NewsSearchResponse(results);
    }

    @GetMapping("/headlines")
    public HeadlinesResponse headlines(@RequestParam(defaultValue = "us") String country,
                                       @RequestParam(required = false) String category) {
        return headlineService.getHeadlines(country, category);
    }
}
