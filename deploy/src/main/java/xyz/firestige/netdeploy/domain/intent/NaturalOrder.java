package xyz.firestige.netdeploy.domain.intent;

import java.util.Comparator;

/**
 * 数字感知的字符串排序：GigabitEthernet2 &lt; GigabitEthernet10，10.255.0.2 &lt; 10.255.0.101。
 * 数字段相同时退回逐字符比较，保证全序。
 */
final class NaturalOrder implements Comparator<String> {

    static final NaturalOrder INSTANCE = new NaturalOrder();

    private NaturalOrder() {
    }

    @Override
    public int compare(String a, String b) {
        if (a == null || b == null) {
            return a == null ? (b == null ? 0 : -1) : 1;
        }
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            char ca = a.charAt(i);
            char cb = b.charAt(j);
            if (Character.isDigit(ca) && Character.isDigit(cb)) {
                int si = i;
                int sj = j;
                while (i < a.length() && Character.isDigit(a.charAt(i))) i++;
                while (j < b.length() && Character.isDigit(b.charAt(j))) j++;
                int cmp = compareDigits(a.substring(si, i), b.substring(sj, j));
                if (cmp != 0) return cmp;
            } else {
                if (ca != cb) return Character.compare(ca, cb);
                i++;
                j++;
            }
        }
        int rest = Integer.compare(a.length() - i, b.length() - j);
        return rest != 0 ? rest : a.compareTo(b);
    }

    private static int compareDigits(String x, String y) {
        String nx = stripZeros(x);
        String ny = stripZeros(y);
        if (nx.length() != ny.length()) {
            return Integer.compare(nx.length(), ny.length());
        }
        return nx.compareTo(ny);
    }

    private static String stripZeros(String s) {
        int k = 0;
        while (k < s.length() - 1 && s.charAt(k) == '0') k++;
        return s.substring(k);
    }
}
