package fr.tcordel.qtable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.stream.Collectors;

/**
 * Map from states to their legal actions and the estimated value of taking each of them.
 * The states and their actions are fixed at construction, only the values change.
 * Not thread safe.
 */
public class QTable<A> {

	private static final Logger LOGGER = LoggerFactory.getLogger(QTable.class);

	public static final double DEFAULT_EPSILON = 0.01;
	public static final double EPSILON_DROPOFF = 5.0;

	private static final Random RANDOM = new Random();

	private final Map<State<A>, Map<A, Double>> table;
	private final double epsilon;
	private final Random random;

	public QTable(State<A> initialState) {
		this(initialState, DEFAULT_EPSILON, RANDOM);
	}

	public QTable(State<A> initialState, double epsilon, Random random) {
		this(initialState, null, epsilon, random);
	}

	public QTable(State<A> initialState, Map<State<A>, Map<A, Double>> table,
			double epsilon, Random random) {
		Objects.requireNonNull(initialState, "initialState");
		if (epsilon < 0 || epsilon > 1) {
			throw new IllegalArgumentException("epsilon must be within [0, 1]: " + epsilon);
		}
		this.epsilon = epsilon;
		this.random = Objects.requireNonNull(random, "random");
		Map<State<A>, Map<A, Double>> states = table == null
				? createInitializedTable(initialState)
				: copyOf(table);
		this.table = Collections.unmodifiableMap(states);
		LOGGER.debug("Q-table ready with {} states", this.table.size());
	}

	/**
	 * @throws TerminalStateException if {@code state} has no legal action
	 */
	public ActionValue<A> getBestMove(State<A> state) {
		List<ActionValue<A>> actions = getPossibleActions(state);
		if (actions.isEmpty()) {
			throw new TerminalStateException(state);
		}
		return state.selectBestAction(actions, random);
	}

	public List<ActionValue<A>> getPossibleActions(State<A> state) {
		return toActionList(getActions(state));
	}

	/**
	 * @throws TerminalStateException if {@code state} has no legal action
	 */
	public ActionValue<A> getNextAction(State<A> state, int episodeNumber) {
		List<ActionValue<A>> actions = getPossibleActions(state);
		if (actions.isEmpty()) {
			throw new TerminalStateException(state);
		}
		if (random.nextDouble() < explorationRate(episodeNumber)) {
			return actions.get(random.nextInt(actions.size()));
		}
		return state.selectBestAction(actions, random);
	}

	/**
	 * Decays from above 1 on episode 0 towards epsilon as the episode number grows.
	 */
	public double explorationRate(int episodeNumber) {
		return epsilon + EPSILON_DROPOFF / (episodeNumber + EPSILON_DROPOFF);
	}

	public void update(State<A> state, ActionValue<A> action, State<A> nextState, double learningRate) {
		update(state, action, nextState, learningRate, 1.0);
	}

	public void update(State<A> state, ActionValue<A> action, State<A> nextState,
			double learningRate, double futureRewardDiscount) {
		Map<A, Double> actions = getActions(state);
		Double oldValue = actions.get(action.action());
		if (oldValue == null) {
			throw new IllegalArgumentException(
					"Action %s is not legal in state %s".formatted(action.action(), state));
		}
		Map<A, Double> nextActions = getActions(nextState);
		double futureValue = nextActions.isEmpty()
				? 0d
				: nextState.selectBestAction(toActionList(nextActions), random).value();
		double reward = nextState.getRewardForLastMove();
		double newValue = oldValue + learningRate * (reward + futureRewardDiscount * futureValue - oldValue);
		actions.put(action.action(), newValue);
	}

	/**
	 * @return the live action values of {@code state}, not a copy
	 */
	public Map<A, Double> getActions(State<A> state) {
		Map<A, Double> actions = table.get(state);
		if (actions == null) {
			throw new UnknownStateException(state);
		}
		return actions;
	}

	public String getFirstNEntriesWithNon0Actions(int n) {
		return table.entrySet()
				.stream()
				.filter(e -> e.getValue().values().stream().mapToDouble(Double::doubleValue).sum() > 0d)
				.limit(Math.max(0, n))
				.map(e -> e.getKey() + "=" + e.getValue())
				.collect(Collectors.joining("\n"));
	}

	public int size() {
		return table.size();
	}

	public double getEpsilon() {
		return epsilon;
	}

	private List<ActionValue<A>> toActionList(Map<A, Double> actions) {
		return actions.entrySet()
				.stream()
				.map(e -> new ActionValue<>(e.getKey(), e.getValue()))
				.toList();
	}

	private static <A> Map<State<A>, Map<A, Double>> copyOf(Map<State<A>, Map<A, Double>> table) {
		Map<State<A>, Map<A, Double>> copy = new LinkedHashMap<>();
		table.forEach((state, actions) -> copy.put(state, new LinkedHashMap<>(actions)));
		return copy;
	}

	private static <A> Map<State<A>, Map<A, Double>> createInitializedTable(State<A> initialState) {
		Map<State<A>, Map<A, Double>> table = new LinkedHashMap<>();
		Deque<State<A>> toVisit = new ArrayDeque<>();
		toVisit.push(initialState);
		while (!toVisit.isEmpty()) {
			State<A> current = toVisit.pop();
			if (table.containsKey(current)) {
				continue;
			}
			Map<A, Double> moves = new LinkedHashMap<>();
			current.getLegalActions().forEach(action -> moves.put(action, 0d));
			table.put(current, moves);

			// pushed in reverse so successors are expanded in action order
			List<A> actions = new ArrayList<>(moves.keySet());
			for (int i = actions.size() - 1; i >= 0; i--) {
				State<A> next = current.makeTransition(actions.get(i));
				if (!table.containsKey(next)) {
					toVisit.push(next);
				}
			}
		}
		return table;
	}

	@Override
	public String toString() {
		return "numEntries=" + table.size();
	}
}
