package fr.tcordel.qtable.learning;

import java.util.ArrayList;
import java.util.List;

public record TrainingResult(List<Double> episodeRewards) {

	public TrainingResult {
		episodeRewards = List.copyOf(episodeRewards);
	}

	public int episodes() {
		return episodeRewards.size();
	}

	public double averageReward() {
		return episodeRewards.stream()
				.mapToDouble(Double::doubleValue)
				.average()
				.orElse(0);
	}

	public List<Double> movingAverage(int window) {
		if (window <= 0) {
			throw new IllegalArgumentException("window must be strictly positive: " + window);
		}
		List<Double> meanValues = new ArrayList<>();
		for (int i = 0; i < episodeRewards.size(); i++) {
			meanValues.add(episodeRewards.subList(Math.max(0, i - window + 1), i + 1)
					.stream()
					.mapToDouble(Double::doubleValue)
					.average()
					.orElse(0));
		}
		return meanValues;
	}
}
