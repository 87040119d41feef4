package fr.tcordel.qtable.learning;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

class QLearnerParametersTest {

	@Test
	void testDefaults() {
		QLearnerParameters parameters = QLearnerParameters.defaults();

		assertThat(parameters.learningRate()).isEqualTo(0.1);
		assertThat(parameters.futureRewardDiscount()).isEqualTo(1.0);
		assertThat(parameters.numEpisodes()).isEqualTo(1000);
		assertThat(parameters.maxStepsPerEpisode()).isEqualTo(1000);
		assertThat(parameters.logInterval()).isEqualTo(100);
	}

	@Test
	void testWithers() {
		QLearnerParameters parameters = QLearnerParameters.defaults()
				.withLearningRate(0.5)
				.withFutureRewardDiscount(0.9)
				.withNumEpisodes(10)
				.withMaxStepsPerEpisode(20)
				.withLogInterval(5);

		assertThat(parameters).isEqualTo(new QLearnerParameters(0.5, 0.9, 10, 20, 5));
	}

	@Test
	void testNegativeEpisodes() {
		assertThatThrownBy(() -> QLearnerParameters.defaults().withNumEpisodes(-1))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("numEpisodes must not be negative: -1");
		assertThat(QLearnerParameters.defaults().withNumEpisodes(0).numEpisodes()).isZero();
	}

	@ParameterizedTest
	@MethodSource("invalidParameters")
	void testInvalidParameters(double learningRate, double discount, int episodes, int maxSteps, int logInterval) {
		assertThatThrownBy(() -> new QLearnerParameters(learningRate, discount, episodes, maxSteps, logInterval))
				.isInstanceOf(IllegalArgumentException.class);
	}

	static Stream<Arguments> invalidParameters() {
		return Stream.of(
				Arguments.of(0d, 1d, 10, 10, 1),
				Arguments.of(1.5, 1d, 10, 10, 1),
				Arguments.of(0.5, -0.1, 10, 10, 1),
				Arguments.of(0.5, 1.1, 10, 10, 1),
				Arguments.of(0.5, 1d, -1, 10, 1),
				Arguments.of(0.5, 1d, 10, 0, 1),
				Arguments.of(0.5, 1d, 10, 10, 0));
	}
}
