package cafe.woden.ircroster;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import cafe.woden.ircroster.app.MembershipCoordinator;
import cafe.woden.ircroster.config.RosterProperties;
import cafe.woden.ircroster.model.RosterChange;
import io.reactivex.rxjava3.core.Flowable;
import org.junit.jupiter.api.Test;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.DefaultApplicationArguments;

class IrcRosterAppTest {

  @Test
  void runnerSubscribesToRosterChanges() throws Exception {
    MembershipCoordinator coordinator = mock(MembershipCoordinator.class);
    when(coordinator.changes())
        .thenReturn(
            Flowable.just(
                RosterChange.channelWide("libera", "#chan", RosterChange.Kind.ROSTER_SYNCED)));

    ApplicationRunner runner = new IrcRosterApp().run(coordinator, RosterProperties.defaults());
    runner.run(new DefaultApplicationArguments());

    verify(coordinator).changes();
  }

  @Test
  void runnerSurvivesFailingChangeStream() throws Exception {
    MembershipCoordinator coordinator = mock(MembershipCoordinator.class);
    when(coordinator.changes()).thenReturn(Flowable.error(new IllegalStateException("boom")));

    ApplicationRunner runner = new IrcRosterApp().run(coordinator, RosterProperties.defaults());
    runner.run(new DefaultApplicationArguments());

    verify(coordinator).changes();
  }
}
