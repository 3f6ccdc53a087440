package edu.isi.hts;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/** left, central and right phones reaching one tree node */
public class TriphoneSet {
	private final SortedSet<String> leftPhones;
	private final SortedSet<String> centralPhones;
	private final SortedSet<String> rightPhones;

	public TriphoneSet() {
		leftPhones = new TreeSet<String>();
		centralPhones = new TreeSet<String>();
		rightPhones = new TreeSet<String>();
	}

	/** every phone in every position */
	public TriphoneSet(Collection<String> phones) {
		leftPhones = new TreeSet<String>(phones);
		centralPhones = new TreeSet<String>(phones);
		rightPhones = new TreeSet<String>(phones);
	}

	public TriphoneSet(TriphoneSet other) {
		leftPhones = new TreeSet<String>(other.leftPhones);
		centralPhones = new TreeSet<String>(other.centralPhones);
		rightPhones = new TreeSet<String>(other.rightPhones);
	}

	public SortedSet<String> getLeftPhones() { return leftPhones; }
	public SortedSet<String> getCentralPhones() { return centralPhones; }
	public SortedSet<String> getRightPhones() { return rightPhones; }

	/** phones of slot 0, 1 or 2 */
	public SortedSet<String> getPhones(int slot) {
		switch (slot) {
		case 0: return leftPhones;
		case 1: return centralPhones;
		case 2: return rightPhones;
		default:
			throw new IllegalArgumentException("No phone slot "+slot);
		}
	}

	public boolean isEmpty() {
		return leftPhones.isEmpty() || centralPhones.isEmpty() || rightPhones.isEmpty();
	}

	public long size() {
		return (long)leftPhones.size() * centralPhones.size() * rightPhones.size();
	}

	/** merge another set into this one, position by position */
	public void addAll(TriphoneSet other) {
		leftPhones.addAll(other.leftPhones);
		centralPhones.addAll(other.centralPhones);
		rightPhones.addAll(other.rightPhones);
	}

	/** every left-central+right combination, as triphone labels */
	public List<Label> getAllTriphones() {
		List<Label> ret = new ArrayList<Label>();
		for (String l : leftPhones) {
			for (String c : centralPhones) {
				for (String r : rightPhones) {
					Label label = new Label(FeatureSchema.TRIPHONE);
					label.setValue(0, l);
					label.setValue(1, c);
					label.setValue(2, r);
					ret.add(label);
				}
			}
		}
		return ret;
	}

	public String toString() {
		return leftPhones+"-"+centralPhones+"+"+rightPhones;
	}
}
