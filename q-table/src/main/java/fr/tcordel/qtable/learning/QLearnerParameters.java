package fr.tcordel.qtable.learning;

public record QLearnerParameters(double learningRate, double futureRewardDiscount,
		int numEpisodes, int maxStepsPerEpisode, int logInterval) {

	public QLearnerParameters {
		if (learningRate <= 0 || learningRate > 1) {
			throw new IllegalArgumentException("learningRate must be within (0, 1]: " + learningRate);
		}
		if (futureRewardDiscount < 0 || futureRewardDiscount > 1) {
			throw new IllegalArgumentException(
					"futureRewardDiscount must be within [0, 1]: " + futureRewardDiscount);
		}
		if (numEpisodes < 0) {
			throw new IllegalArgumentException("numEpisodes must not be negative: " + numEpisodes);
		}
		if (maxStepsPerEpisode <= 0) {
			throw new IllegalArgumentException("maxStepsPerEpisode must be strictly positive: " + maxStepsPerEpisode);
		}
		if (logInterval <= 0) {
			throw new IllegalArgumentException("logInterval must be strictly positive: " + logInterval);
		}
	}

	public static QLearnerParameters defaults() {
		return new QLearnerParameters(0.1, 1.0, 1000, 1000, 100);
	}

	public QLearnerParameters withLearningRate(double learningRate) {
		return new QLearnerParameters(learningRate, futureRewardDiscount, numEpisodes, maxStepsPerEpisode, logInterval);
	}

	public QLearnerParameters withFutureRewardDiscount(double futureRewardDiscount) {
		return new QLearnerParameters(learningRate, futureRewardDiscount, numEpisodes, maxStepsPerEpisode, logInterval);
	}

	public QLearnerParameters withNumEpisodes(int numEpisodes) {
		return new QLearnerParameters(learningRate, futureRewardDiscount, numEpisodes, maxStepsPerEpisode, logInterval);
	}

	public QLearnerParameters withMaxStepsPerEpisode(int maxStepsPerEpisode) {
		return new QLearnerParameters(learningRate, futureRewardDiscount, numEpisodes, maxStepsPerEpisode, logInterval);
	}

	public QLearnerParameters withLogInterval(int logInterval) {
		return new QLearnerParameters(learningRate, futureRewardDiscount, numEpisodes, maxStepsPerEpisode, logInterval);
	}
}
