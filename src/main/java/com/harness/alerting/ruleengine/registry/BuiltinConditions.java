package com.harness.alerting.ruleengine.registry;

import com.harness.alerting.model.EventState;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class BuiltinConditions {

  @Bean
  public ConditionHandler everyEventCondition() {
    return new StateTransitionCondition("every_event", state -> true);
  }

  @Bean
  public ConditionHandler firstSeenEventCondition() {
    return new StateTransitionCondition("first_seen_event", EventState::isNew);
  }

  @Bean
  public ConditionHandler regressionEventCondition() {
    return new StateTransitionCondition("regression_event", EventState::isRegression);
  }

  @Bean
  public ConditionHandler reappearedEventCondition() {
    return new StateTransitionCondition("reappeared_event", EventState::hasReappeared);
  }

  @Bean
  public ConditionHandler escalatingEventCondition() {
    return new StateTransitionCondition("escalating_event", EventState::hasEscalated);
  }

  @Bean
  public ConditionHandler newEnvironmentEventCondition() {
    return new StateTransitionCondition("new_environment_event", EventState::isNewGroupEnvironment);
  }
}
