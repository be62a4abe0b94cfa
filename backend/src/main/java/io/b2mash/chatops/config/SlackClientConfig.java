package io.b2mash.chatops.config;

import io.b2mash.chatops.slack.message.SlackColorPalette;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({SlackProperties.class, SlackColorProperties.class})
public class SlackClientConfig {

  @Bean
  public SlackColorPalette slackColorPalette(SlackColorProperties colorProperties) {
    return colorProperties.toPalette();
  }
}
