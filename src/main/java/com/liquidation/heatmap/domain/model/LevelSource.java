package com.liquidation.heatmap.domain.model;

public sealed interface LevelSource permits LevelSource.LeverageTier, LevelSource.RawEvent {

    String key();

    record LeverageTier(int leverage) implements LevelSource {
        @Override
        public String key() {
            return leverage + "x";
        }
    }

    record RawEvent(String eventId) implements LevelSource {
        @Override
        public String key() {
            return eventId;
        }
    }
}
