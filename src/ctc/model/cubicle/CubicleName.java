package ctc.model.cubicle;

import ctc.InternalCompilerError;
import ctc.model.template.TemplateReference;
import ctc.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An identifier made of literal fragments interleaved with template references:
 * fragments.get(0) references.get(0) fragments.get(1) ... fragments.get(n). Fragments may be
 * empty strings. An expanded name has no reference and a single fragment.
 */
public class CubicleName extends CubicleNode {

	private final List<String> fragments;
	private final List<TemplateReference> references;

	public CubicleName(SourceLocation location, List<String> fragments, List<TemplateReference> references) {
		super(location);
		if (fragments.size() != references.size() + 1) {
			throw new InternalCompilerError("name fragments and references are not interleaved");
		}
		this.fragments = fragments;
		this.references = references;
	}

	public CubicleName(SourceLocation location, String text) {
		this(location, Collections.singletonList(text), Collections.emptyList());
	}

	public List<String> getFragments() {
		return fragments;
	}

	public List<TemplateReference> getReferences() {
		return references;
	}

	public boolean isExpanded() {
		return references.isEmpty();
	}

	/**
	 * @return the text of an expanded name
	 */
	public String getText() {
		if (!isExpanded()) {
			throw new InternalCompilerError("text of unexpanded name requested");
		}
		return fragments.get(0);
	}

	@Override
	public <T, E extends Throwable> T accept(CubicleNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(fragments, references);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		CubicleName other = (CubicleName) obj;
		return fragments.equals(other.fragments) && references.equals(other.references);
	}

}
