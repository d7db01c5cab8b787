package sumtree;

/**
 * Sorted sum tree: a set of unique keys, each carrying a weight.
 *
 * Every entry covers the half-open range [offset, offset + weight) where offset is
 * the sum of the weights of all entries with smaller keys. Ranges touch but never
 * overlap, so {@link #find(long)} maps any point of [0, total) back to exactly one key.
 *
 * The tree is leaf-oriented: keys and weights live in leaves, internal nodes only
 * route (their key is the smallest key of the right subtree) and cache the sum of
 * the weights below them. It is not rebalanced and not thread-safe; see
 * {@link LockedWeightedIndex} for shared use.
 */
public class WeightedIndex<K extends Comparable<? super K>> {
    //--------------------------------------------------------------------------------
    // Class: Node, LeafNode, InternalNode
    //--------------------------------------------------------------------------------
    protected static abstract class Node<E extends Comparable<? super E>> {
        E key;                      // internal: smallest key of the right subtree, reset on remove
        long value;                 // leaf: own weight, internal: sum of both children
        InternalNode<E> parent;     // null for the root
        Node(final E key, final long value) {
            this.key = key;
            this.value = value;
        }
    }

    protected final static class LeafNode<E extends Comparable<? super E>> extends Node<E> {
        LeafNode(final E key, final long weight) {
            super(key, weight);
        }
    }

    protected final static class InternalNode<E extends Comparable<? super E>> extends Node<E> {
        Node<E> left;
        Node<E> right;

        InternalNode(final E key, final LeafNode<E> left, final LeafNode<E> right) {
            super(key, left.value + right.value);
            this.left = left;
            this.right = right;
            left.parent = this;
            right.parent = this;
        }
    }

    //--------------------------------------------------------------------------------
    // DICTIONARY
    //--------------------------------------------------------------------------------
    private Node<K> root;
    private int size;

    public WeightedIndex() {
        // empty tree has no root; the first put creates a single leaf
    }

//--------------------------------------------------------------------------------
// PUBLIC METHODS:
// - put    : boolean
// - get    : Placement
// - remove : boolean
// - find   : K
//--------------------------------------------------------------------------------

    // Insert key with the given weight, or replace the weight if the key is already present.
    // Returns true if a new entry was created, false if an existing one was updated.
    /** PRECONDITION: key CANNOT BE NULL **/
    public final boolean put(final K key, final long weight) {
        if (key == null) throw new NullPointerException();

        if (root == null) {
            root = new LeafNode<K>(key, weight);
            size++;
            return true;
        }

        /** SEARCH **/
        Node<K> l = root;
        while (l.getClass() == InternalNode.class) {
            InternalNode<K> p = (InternalNode<K>) l;
            l = (key.compareTo(p.key) < 0) ? p.left : p.right;
        }
        /** END SEARCH **/

        LeafNode<K> foundLeaf = (LeafNode<K>) l;

        if (key.compareTo(foundLeaf.key) == 0) {
            final long delta = weight - foundLeaf.value;
            foundLeaf.value = weight;
            propagate(foundLeaf.parent, delta);
            return false;
        }

        final InternalNode<K> p = foundLeaf.parent;
        final LeafNode<K> newNode = new LeafNode<K>(key, weight);
        final InternalNode<K> newInternal;
        if (key.compareTo(foundLeaf.key) < 0)   // newInternal.key = max(foundLeaf.key, key)
            newInternal = new InternalNode<K>(foundLeaf.key, newNode, foundLeaf);
        else
            newInternal = new InternalNode<K>(key, foundLeaf, newNode);

        // replace the leaf by the small subtree
        newInternal.parent = p;
        if (p == null) {
            root = newInternal;
        } else if (p.left == foundLeaf) {
            p.left = newInternal;
        } else {
            p.right = newInternal;
        }
        propagate(p, weight);
        size++;
        return true;
    }

    /**
     * Looks up the weight of {@code key} and the offset at which its range starts.
     *
     * @return the placement of the entry, or null if the key is not present
     * @throws NullPointerException if key is null
     */
    public final Placement get(final K key) {
        if (key == null) throw new NullPointerException();
        if (root == null) return null;

        long offset = 0;
        Node<K> l = root;
        while (l.getClass() == InternalNode.class) {
            InternalNode<K> p = (InternalNode<K>) l;
            if (key.compareTo(p.key) < 0) {
                l = p.left;
            } else {
                offset += p.left.value;
                l = p.right;
            }
        }
        return (key.compareTo(l.key) == 0) ? new Placement(l.value, offset) : null;
    }

    /** PRECONDITION: key CANNOT BE NULL **/
    public final boolean containsKey(final K key) {
        return get(key) != null;
    }

    // Delete key from the tree, returns true when an entry was removed, false if the key was absent
    /** PRECONDITION: key CANNOT BE NULL **/
    public final boolean remove(final K key) {
        if (key == null) throw new NullPointerException();
        if (root == null) return false;

        /** SEARCH VARIABLES **/
        InternalNode<K> gp = null;
        InternalNode<K> p = null;
        InternalNode<K> router = null;  // ancestor whose key equals the searched key
        Node<K> l = root;
        /** END SEARCH VARIABLES **/

        /** SEARCH **/
        while (l.getClass() == InternalNode.class) {
            gp = p;
            p = (InternalNode<K>) l;
            final int c = key.compareTo(p.key);
            if (c == 0) router = p;
            l = (c < 0) ? p.left : p.right;
        }
        /** END SEARCH **/

        if (key.compareTo(l.key) != 0) return false;

        if (p == null) {
            // the leaf was the only entry
            clear();
            return true;
        }

        // splice the sibling into the parent's slot
        final Node<K> other = (p.right == l) ? p.left : p.right;
        other.parent = gp;
        if (gp == null) {
            root = other;
        } else if (gp.left == p) {
            gp.left = other;
        } else {
            gp.right = other;
        }
        // the removed key was the minimum of router's right subtree; p itself is gone
        if (router != null && router != p) {
            router.key = minKey(router.right);
        }
        propagate(gp, -l.value);
        size--;
        return true;
    }

    /**
     * Returns the key whose range contains {@code point}, that is the entry with
     * {@code offset <= point < offset + weight}.
     *
     * @return the key, or null if the point lies outside [0, total)
     */
    public final K find(final long point) {
        if (root == null || point < 0) return null;

        long offset = 0;
        Node<K> l = root;
        while (l.getClass() == InternalNode.class) {
            InternalNode<K> p = (InternalNode<K>) l;
            // point outside the range of this subtree
            if (point > offset + p.value) return null;

            final long mid = offset + p.left.value;
            if (point < mid) {
                l = p.left;
            } else {
                offset = mid;
                l = p.right;
            }
        }
        if (point >= offset + l.value) return null;
        return l.key;
    }

    // Sum of all weights, O(1)
    public final long total() {
        return (root == null) ? 0 : root.value;
    }

    // Number of entries, O(1)
    public final int size() {
        return size;
    }

    public final boolean isEmpty() {
        return size == 0;
    }

    public final void clear() {
        root = null;
        size = 0;
    }

//--------------------------------------------------------------------------------
// PRIVATE METHODS
// - propagate
//--------------------------------------------------------------------------------

    // Adds delta to the cached sum of start and of every ancestor up to the root
    private static <E extends Comparable<? super E>> void propagate(InternalNode<E> start, final long delta) {
        InternalNode<E> x = start;
        while (x != null) {
            x.value += delta;
            x = x.parent;
        }
    }

    /**
     *
     * DEBUG CODE (FOR TESTBED)
     *
     */

    public String dump() {
        StringBuilder sb = new StringBuilder("WeightedIndex\n");
        if (root != null) dump(root, 0, sb);
        return sb.toString();
    }

    private void dump(Node<K> node, int indent, StringBuilder sb) {
        for (int i = 0; i < indent; i++) sb.append(' ');
        if (node.getClass() == LeafNode.class) {
            sb.append("- ").append(node.key).append('/').append(node.value).append('\n');
        } else {
            InternalNode<K> i = (InternalNode<K>) node;
            sb.append("+ ").append(i.key).append('/').append(i.value).append('\n');
            dump(i.left, indent + 2, sb);
            dump(i.right, indent + 2, sb);
        }
    }

    public void print() {
        System.out.print(dump());
    }

    public int sizeStructural() {
        return (root == null) ? 0 : sizeStructural(root);
    }
    private int sizeStructural(Node<K> n) {
        if (n instanceof LeafNode) return 1;
        InternalNode<K> i = (InternalNode<K>) n;
        return sizeStructural(i.left) + sizeStructural(i.right);
    }

    // Sum of the leaf weights, recomputed without the cached values of internal nodes
    public long totalStructural() {
        return (root == null) ? 0 : totalStructural(root);
    }
    private long totalStructural(Node<K> n) {
        if (n instanceof LeafNode) return n.value;
        InternalNode<K> i = (InternalNode<K>) n;
        return totalStructural(i.left) + totalStructural(i.right);
    }

    // Number of nodes on the longest root-to-leaf path, 0 for an empty tree
    public int height() {
        return height(root);
    }
    private int height(Node<K> n) {
        if (n == null) return 0;
        if (n instanceof LeafNode) return 1;
        InternalNode<K> i = (InternalNode<K>) n;
        return 1 + Math.max(height(i.left), height(i.right));
    }

    // Checks cached sums, parent links and key order of the whole tree
    public boolean isConsistent() {
        if (root == null) return size == 0;
        if (root.parent != null) return false;
        return isConsistent(root, null, null) && sizeStructural() == size;
    }
    private boolean isConsistent(Node<K> n, K low, K high) {
        // every key k below n must satisfy low <= k < high
        if (low != null && n.key.compareTo(low) < 0) return false;
        if (high != null && n.key.compareTo(high) >= 0) return false;
        if (n instanceof LeafNode) return true;
        InternalNode<K> i = (InternalNode<K>) n;
        if (i.left.parent != i || i.right.parent != i) return false;
        if (i.value != i.left.value + i.right.value) return false;
        if (minKey(i.right).compareTo(i.key) != 0) return false;
        return isConsistent(i.left, low, i.key) && isConsistent(i.right, i.key, high);
    }

    private K minKey(Node<K> n) {
        while (n.getClass() == InternalNode.class) n = ((InternalNode<K>) n).left;
        return n.key;
    }
}
