package io.distinction.sketch;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The sample set of a {@link CvmSketch}: at most one reference per distinct value.
 *
 * <p>Elements are kept in a list for a stable thinning order, with a value-to-slot index so that
 * lookups and removals do not scan the list. A removal moves the last element into the freed slot.
 */
class SampleBuffer<T>
{
  private final List<T> elements = new ArrayList<>();
  private final Map<T, Integer> slots = new HashMap<>();

  int size()
  {
    return elements.size();
  }

  boolean contains(T value)
  {
    return slots.containsKey(value);
  }

  /**
   * @return false if an equal value is already present
   */
  boolean add(T value)
  {
    if (slots.containsKey(value)) {
      return false;
    }
    slots.put(value, elements.size());
    elements.add(value);
    return true;
  }

  /**
   * @return true if a value equal to {@code value} was present
   */
  boolean remove(T value)
  {
    final Integer slot = slots.remove(value);
    if (slot == null) {
      return false;
    }
    final T last = elements.remove(elements.size() - 1);
    if (slot < elements.size()) {
      elements.set(slot, last);
      slots.put(last, slot);
    }
    return true;
  }

  /**
   * Keeps each element independently with probability 1/2, drawing once per element in slot order.
   * An element survives iff its draw is {@code >= 0.5}.
   *
   * @return the number of elements dropped
   */
  int thin(RandomSource random)
  {
    int kept = 0;
    for (int i = 0; i < elements.size(); i++) {
      final T value = elements.get(i);
      if (random.nextDouble() >= 0.5) {
        elements.set(kept, value);
        slots.put(value, kept);
        kept++;
      } else {
        slots.remove(value);
      }
    }
    final int dropped = elements.size() - kept;
    elements.subList(kept, elements.size()).clear();
    return dropped;
  }

  T get(int slot)
  {
    return elements.get(slot);
  }
}
