package com.scholary.audiobook.enhancer.citation;

/**
 * Reads four-digit years the way a narrator would: 1964 is "nineteen sixty-four", 1905 is
 * "nineteen oh five", 2010 is "twenty ten".
 *
 * <p>Only 1000 to 2099 are converted. Anything else, including non-numeric input, is returned
 * unchanged.
 */
public final class YearSpeller {

  private static final String[] ONES = {
    "zero", "one", "two", "three", "four", "five", "six", "seven", "eight", "nine", "ten",
    "eleven", "twelve", "thirteen", "fourteen", "fifteen", "sixteen", "seventeen", "eighteen",
    "nineteen"
  };

  private static final String[] TENS = {
    "", "", "twenty", "thirty", "forty", "fifty", "sixty", "seventy", "eighty", "ninety"
  };

  private YearSpeller() {}

  public static String speak(String year) {
    if (year == null) {
      return null;
    }
    int value;
    try {
      value = Integer.parseInt(year.strip());
    } catch (NumberFormatException e) {
      return year;
    }
    if (value < 1000 || value > 2099) {
      return year;
    }

    int century = value / 100;
    int remainder = value % 100;

    if (value >= 2000) {
      return remainder == 0 ? "twenty hundred" : "twenty " + belowHundred(remainder);
    }
    if (remainder == 0) {
      return belowHundred(century) + " hundred";
    }
    if (remainder < 10) {
      return belowHundred(century) + " oh " + ONES[remainder];
    }
    return belowHundred(century) + " " + belowHundred(remainder);
  }

  static String belowHundred(int number) {
    if (number < 20) {
      return ONES[number];
    }
    int ones = number % 10;
    return ones == 0 ? TENS[number / 10] : TENS[number / 10] + "-" + ONES[ones];
  }
}
