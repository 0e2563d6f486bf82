package io.intellixity.pagekit.examples.config;

import io.intellixity.pagekit.PagingEngine;
import io.intellixity.pagekit.examples.service.UserDirectory;
import io.intellixity.pagekit.query.QueryStringTranslator;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(PagekitProperties.class)
public class PagekitExampleConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public UserDirectory userDirectory(PagekitProperties props, Clock clock) {
    return new UserDirectory(props.getSeedUsers(), clock);
  }

  @Bean
  public PagingEngine pagingEngine(PagekitProperties props) {
    return new PagingEngine(props.toPagingConfig(UserDirectory.SCHEMA), UserDirectory.SEARCH_FIELDS);
  }

  @Bean
  public QueryStringTranslator queryStringTranslator() {
    // operands are typed by the directory schema so age_gte=30 compares numerically
    return new QueryStringTranslator(UserDirectory.SCHEMA);
  }
}
