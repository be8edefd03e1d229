package com.zenith.scalp;

import static com.zenith.scalp.ScalpFixtures.candle;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.zenith.market.Candle;

class VolumeProfileCalculatorTest {

	@Test
	void valueAreaGrowsTowardHeavierNeighbour() {
		List<Candle> candles = List.of(
				candle(0, 100, 110, 100, 105, 10),
				candle(1, 104, 105, 104, 105, 100));

		VolumeProfile profile = VolumeProfileCalculator.compute(candles, 10);

		assertThat(profile.poc()).isCloseTo(104.5, within(1e-9));
		assertThat(profile.val()).isCloseTo(104.0, within(1e-9));
		assertThat(profile.vah()).isCloseTo(106.0, within(1e-9));
		assertThat(profile.lowVolumeNodes()).isEmpty();
		assertThat(profile.contains(105.0)).isTrue();
		assertThat(profile.contains(103.0)).isFalse();
	}

	@Test
	void thinBinsInsideValueAreaAreLowVolumeNodes() {
		List<Candle> candles = List.of(
				candle(0, 100, 110, 100, 105, 10),
				candle(1, 102, 103, 102, 103, 40),
				candle(2, 106, 107, 106, 107, 40));

		VolumeProfile profile = VolumeProfileCalculator.compute(candles, 10);

		assertThat(profile.poc()).isCloseTo(102.5, within(1e-9));
		assertThat(profile.val()).isCloseTo(102.0, within(1e-9));
		assertThat(profile.vah()).isCloseTo(107.0, within(1e-9));
		assertThat(profile.lowVolumeNodes()).hasSize(2);
		assertThat(profile.lowVolumeNodes().get(0)).isCloseTo(104.5, within(1e-9));
		assertThat(profile.lowVolumeNodes().get(1)).isCloseTo(105.5, within(1e-9));
	}

	@Test
	void flatWindowCollapsesToSinglePrice() {
		List<Candle> candles = List.of(candle(0, 50, 50, 50, 50, 5), candle(1, 50, 50, 50, 50, 7));

		VolumeProfile profile = VolumeProfileCalculator.compute(candles, VolumeProfileCalculator.DEFAULT_BINS);

		assertThat(profile.poc()).isEqualTo(50.0);
		assertThat(profile.vah()).isEqualTo(50.0);
		assertThat(profile.val()).isEqualTo(50.0);
		assertThat(profile.lowVolumeNodes()).isEmpty();
	}

	@Test
	void emptyWindowIsRejected() {
		assertThatThrownBy(() -> VolumeProfileCalculator.compute(List.of(), 48))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
