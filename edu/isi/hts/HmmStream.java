package edu.isi.hts;

import java.util.ArrayList;
import java.util.List;

/**
 * A named Gaussian mixture. Phone, model type, state and stream come from
 * the name.
 */
public class HmmStream {
	private String name;
	private Gaussian[] gaussians;

	public HmmStream(String name, Gaussian[] gaussians) {
		this.name = name;
		this.gaussians = gaussians;
	}

	public String getName() { return name; }
	public void setName(String n) { name = n; }
	public Gaussian[] getGaussians() { return gaussians; }

	public String getPhone() { return HmmStreamName.parsePhone(name); }
	public HmmModelType getModelType() { return HmmStreamName.parseModelType(name); }
	public int getStateIndex() { return HmmStreamName.parseStateIndex(name); }
	public int getStreamIndex() { return HmmStreamName.parseStreamIndex(name); }

	/** dimension of the first Gaussian, 0 for an empty mixture */
	public int getDimension() {
		return gaussians.length == 0 ? 0 : gaussians[0].getLength();
	}

	/** two Gaussians, the second all zero */
	public ModelDistributionType getDistributionType() {
		if (gaussians.length == 0)
			return ModelDistributionType.NOT_DEFINED;
		if (gaussians.length == 2 && gaussians[1].isZero())
			return ModelDistributionType.MSD;
		return ModelDistributionType.CONTINUOUS;
	}

	/** copy keeping the first keep dimensions of every Gaussian */
	public HmmStream prune(int keep) {
		Gaussian[] pruned = new Gaussian[gaussians.length];
		for (int i = 0; i < gaussians.length; i++)
			pruned[i] = gaussians[i].prune(keep);
		return new HmmStream(name, pruned);
	}

	public static List<HmmStream> prune(List<HmmStream> streams, int keep) {
		List<HmmStream> ret = new ArrayList<HmmStream>(streams.size());
		for (HmmStream s : streams)
			ret.add(s.prune(keep));
		return ret;
	}

	public boolean isNameEqual(HmmStream other) {
		return getPhone().equals(other.getPhone()) &&
			getModelType() == other.getModelType() &&
			getStateIndex() == other.getStateIndex() &&
			getStreamIndex() == other.getStreamIndex();
	}

	/**
	 * Same name parts (unless either is unnamed) and the same non-empty
	 * Gaussians, values compared within a relative or absolute 1e-5.
	 */
	public boolean approximatelyEquals(HmmStream other, boolean compareData) {
		if (name != null && other.name != null && !isNameEqual(other))
			return false;
		List<Gaussian> mine = nonEmpty(gaussians);
		List<Gaussian> theirs = nonEmpty(other.gaussians);
		if (mine.size() != theirs.size())
			return false;
		for (int i = 0; i < mine.size(); i++)
			if (!mine.get(i).approximatelyEquals(theirs.get(i), compareData))
				return false;
		return true;
	}

	private static List<Gaussian> nonEmpty(Gaussian[] gs) {
		List<Gaussian> ret = new ArrayList<Gaussian>();
		for (Gaussian g : gs)
			if (g.getLength() > 0)
				ret.add(g);
		return ret;
	}

	public String toString() {
		return name+" ("+gaussians.length+" x "+getDimension()+")";
	}
}
