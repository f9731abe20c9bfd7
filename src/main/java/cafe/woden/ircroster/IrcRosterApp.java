package cafe.woden.ircroster;

import cafe.woden.ircroster.app.MembershipCoordinator;
import cafe.woden.ircroster.config.RosterProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
@EnableConfigurationProperties({RosterProperties.class})
public class IrcRosterApp {
  private static final Logger log = LoggerFactory.getLogger(IrcRosterApp.class);

  public static void main(String[] args) {
    new SpringApplicationBuilder(IrcRosterApp.class)
        .web(WebApplicationType.NONE)
        .headless(true)
        .run(args);
  }

  @Bean
  public ApplicationRunner run(MembershipCoordinator coordinator, RosterProperties props) {
    return args -> {
      log.info(
          "[ircroster] ready casemapping={} prefix={} chantypes={} chanmodes={}",
          props.casemapping(),
          props.prefix(),
          props.chanTypes(),
          props.chanModes());
      coordinator
          .changes()
          .subscribe(
              change -> {
                if (log.isTraceEnabled()) log.trace("[ircroster] change {}", change);
              },
              err -> log.error("[ircroster] roster change stream failed", err));
    };
  }
}
