package com.github.adamzv.kafkaadmin.ports;

@FunctionalInterface
public interface GroupConsumerProvider {

  GroupConsumerPort open(String groupId);
}
