package com.gentoro.docextract.source;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Orders names the way people read them: digit runs compare by numeric value and other text
 * compares case-insensitively, so {@code img2.png} sorts before {@code img10.png}.
 */
public final class NaturalOrderComparator implements Comparator<String> {
  public static final NaturalOrderComparator INSTANCE = new NaturalOrderComparator();

  @Override
  public int compare(String a, String b) {
    List<String> left = chunks(a);
    List<String> right = chunks(b);
    int n = Math.min(left.size(), right.size());
    for (int i = 0; i < n; i++) {
      String x = left.get(i);
      String y = right.get(i);
      boolean xDigits = Character.isDigit(x.charAt(0));
      boolean yDigits = Character.isDigit(y.charAt(0));
      int cmp;
      if (xDigits && yDigits) {
        cmp = new BigInteger(x).compareTo(new BigInteger(y));
      } else if (xDigits != yDigits) {
        // numbers sort before text
        cmp = xDigits ? -1 : 1;
      } else {
        cmp = x.toLowerCase(Locale.ROOT).compareTo(y.toLowerCase(Locale.ROOT));
      }
      if (cmp != 0) {
        return cmp;
      }
    }
    int bySize = Integer.compare(left.size(), right.size());
    return bySize != 0 ? bySize : a.compareTo(b);
  }

  private static List<String> chunks(String s) {
    List<String> out = new ArrayList<>();
    int i = 0;
    while (i < s.length()) {
      int start = i;
      boolean digit = Character.isDigit(s.charAt(i));
      while (i < s.length() && Character.isDigit(s.charAt(i)) == digit) {
        i++;
      }
      out.add(s.substring(start, i));
    }
    return out;
  }
}
