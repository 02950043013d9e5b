package dumb.bao;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Operations over an ordered list of root Forms. Order is kept for storage and ignored for equivalence. */
public final class Forest {

    private Forest() {
    }

    public static List<String> signatures(Collection<Form> forms) {
        return forms.stream().map(Form::signature).sorted().toList();
    }

    public static boolean equivalent(List<Form> left, List<Form> right) {
        return left.size() == right.size() && signatures(left).equals(signatures(right));
    }

    /** Win condition: the current forest matches the goal exactly, no subset or superset. */
    public static boolean solves(List<Form> current, List<Form> goal) {
        return equivalent(current, goal);
    }

    public static List<Form> deepClone(Collection<Form> forms) {
        var copies = new ArrayList<Form>(forms.size());
        for (var f : forms) copies.add(f.deepClone());
        return copies;
    }

    public static Set<String> ids(Collection<Form> forms) {
        var ids = new LinkedHashSet<String>();
        forms.forEach(f -> f.traverse(n -> ids.add(n.id)));
        return ids;
    }

    public static String notation(Collection<Form> forms) {
        return notation(forms, false);
    }

    public static String notation(Collection<Form> forms, boolean withIds) {
        var sb = new StringBuilder();
        for (var f : forms) {
            if (!sb.isEmpty()) sb.append(' ');
            f.notation(sb, withIds);
        }
        return sb.toString();
    }
}
