package fr.tcordel.qtable.learning;

import fr.tcordel.qtable.ActionValue;
import fr.tcordel.qtable.QTable;
import fr.tcordel.qtable.State;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class QLearner<A> {

	private static final Logger LOGGER = LoggerFactory.getLogger(QLearner.class);

	private final QTable<A> table;
	private final QLearnerParameters parameters;

	public QLearner(QTable<A> table, QLearnerParameters parameters) {
		this.table = Objects.requireNonNull(table, "table");
		this.parameters = Objects.requireNonNull(parameters, "parameters");
	}

	public TrainingResult train(State<A> initialState) {
		List<Double> rewards = new ArrayList<>(parameters.numEpisodes());
		for (int episode = 1; episode <= parameters.numEpisodes(); episode++) {
			double totalReward = runEpisode(initialState, episode);
			rewards.add(totalReward);
			LOGGER.debug("ep {}, totalReward {}", episode, totalReward);
			if (episode % parameters.logInterval() == 0) {
				LOGGER.info("Learning {}/{}, exploration rate {}, mean reward of last {} episodes {}",
						episode, parameters.numEpisodes(), table.explorationRate(episode),
						parameters.logInterval(),
						rewards.subList(episode - parameters.logInterval(), episode)
								.stream()
								.mapToDouble(Double::doubleValue)
								.average()
								.orElse(0));
			}
		}
		LOGGER.info("Training done, {}", table);
		return new TrainingResult(rewards);
	}

	public double runEpisode(State<A> initialState, int episodeNumber) {
		double totalReward = 0;
		State<A> state = initialState;
		for (int step = 0; step < parameters.maxStepsPerEpisode() && !state.isTerminal(); step++) {
			ActionValue<A> action = table.getNextAction(state, episodeNumber);
			State<A> nextState = state.makeTransition(action.action());
			table.update(state, action, nextState,
					parameters.learningRate(), parameters.futureRewardDiscount());
			totalReward += nextState.getRewardForLastMove();
			state = nextState;
		}
		return totalReward;
	}

	public List<A> greedyPath(State<A> initialState, int maxSteps) {
		List<A> path = new ArrayList<>();
		State<A> state = initialState;
		while (path.size() < maxSteps && !state.isTerminal()) {
			A action = table.getBestMove(state).action();
			path.add(action);
			state = state.makeTransition(action);
		}
		return path;
	}

	public QTable<A> getTable() {
		return table;
	}
}
