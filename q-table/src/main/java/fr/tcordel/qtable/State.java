package fr.tcordel.qtable;

import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * Used as a table key: implementations must be immutable and implement equals and hashCode.
 */
public interface State<A> {

	/**
	 * @return empty when terminal
	 */
	List<A> getLegalActions();

	State<A> makeTransition(A action);

	/**
	 * @return the reward for having just arrived in this state
	 */
	double getRewardForLastMove();

	default boolean isTerminal() {
		return getLegalActions().isEmpty();
	}

	/**
	 * Picks the highest value, at random among ties.
	 *
	 * @throws TerminalStateException if {@code actions} is empty
	 */
	default ActionValue<A> selectBestAction(List<ActionValue<A>> actions, Random random) {
		if (actions.isEmpty()) {
			throw new TerminalStateException(this);
		}
		List<ActionValue<A>> sorted = actions.stream()
				.sorted(Comparator.comparingDouble((ActionValue<A> actionValue) -> actionValue.value())
						.reversed())
				.toList();
		int maxIndex = 1;
		double highestValue = sorted.get(0).value();
		for (int i = 1; i < sorted.size(); i++) {
			if (highestValue == sorted.get(i).value()) {
				maxIndex++;
			} else {
				break;
			}
		}
		return sorted.get(random.nextInt(maxIndex));
	}
}
