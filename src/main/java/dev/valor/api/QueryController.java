package dev.valor.api;

import dev.valor.filter.FilterParser;
import dev.valor.query.FilterQueryService;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Compiles a filter and returns the selected rows. */
@RestController
@RequestMapping("/queries")
public class QueryController {

  private final FilterQueryService filterQueryService;

  public QueryController(FilterQueryService filterQueryService) {
    this.filterQueryService = filterQueryService;
  }

  @PostMapping
  public List<Map<String, Object>> query(@RequestBody QueryRequestBody body) {
    return filterQueryService.select(
        FilterParser.parse(body.filter()), body.pivot(), body.link(), body.columns());
  }
}
