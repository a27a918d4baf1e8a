package com.localization.catalog.plural;

import java.util.function.LongToIntFunction;

/**
 * The plural rule families of gettext. Each family knows its form count, its
 * {@code Plural-Forms} expression and how to select a form for a count.
 */
public enum PluralFamily {
    ONE_FORM(1, "plural=0", n -> 0),
    TWO_FORMS_NOT_ONE(2, "plural=(n != 1)", n -> n == 1 ? 0 : 1),
    TWO_FORMS_GREATER_THAN_ONE(2, "plural=(n > 1)", n -> n > 1 ? 1 : 0),
    SLAVIC(3, "plural=(n%10==1 && n%100!=11 ? 0 : n%10>=2 && n%10<=4 && (n%100<10 || n%100>=20) ? 1 : 2)",
            n -> {
                if (n % 10 == 1 && n % 100 != 11) return 0;
                if (n % 10 >= 2 && n % 10 <= 4 && (n % 100 < 10 || n % 100 >= 20)) return 1;
                return 2;
            }),
    CZECH_SLOVAK(3, "plural=(n==1) ? 0 : (n>=2 && n<=4) ? 1 : 2",
            n -> n == 1 ? 0 : (n >= 2 && n <= 4) ? 1 : 2),
    ARABIC(6, "plural=(n==0 ? 0 : n==1 ? 1 : n==2 ? 2 : n%100>=3 && n%100<=10 ? 3 : n%100>=11 ? 4 : 5)",
            n -> {
                if (n <= 2) return (int) n;
                if (n % 100 >= 3 && n % 100 <= 10) return 3;
                if (n % 100 >= 11) return 4;
                return 5;
            }),
    KASHUBIAN(3, "plural=(n==1) ? 0 : n%10>=2 && n%10<=4 && (n%100<10 || n%100>=20) ? 1 : 2",
            n -> n == 1 ? 0 : PluralFamily.isFew(n) ? 1 : 2),
    WELSH(4, "plural=(n==1) ? 0 : (n==2) ? 1 : (n != 8 && n != 11) ? 2 : 3",
            n -> n == 1 ? 0 : n == 2 ? 1 : (n != 8 && n != 11) ? 2 : 3),
    IRISH(5, "plural=n==1 ? 0 : n==2 ? 1 : (n>2 && n<7) ? 2 :(n>6 && n<11) ? 3 : 4",
            n -> n == 1 ? 0 : n == 2 ? 1 : (n > 2 && n < 7) ? 2 : (n > 6 && n < 11) ? 3 : 4),
    SCOTTISH_GAELIC(4, "plural=(n==1 || n==11) ? 0 : (n==2 || n==12) ? 1 : (n > 2 && n < 20) ? 2 : 3",
            n -> (n == 1 || n == 11) ? 0 : (n == 2 || n == 12) ? 1 : (n > 2 && n < 20) ? 2 : 3),
    ICELANDIC(2, "plural=(n%10!=1 || n%100==11)",
            n -> (n % 10 == 1 && n % 100 != 11) ? 0 : 1),
    JAVANESE(2, "plural=(n != 0)", n -> n == 0 ? 0 : 1),
    CORNISH(4, "plural=(n==1) ? 0 : (n==2) ? 1 : (n == 3) ? 2 : 3",
            n -> n == 1 ? 0 : n == 2 ? 1 : n == 3 ? 2 : 3),
    LITHUANIAN(3, "plural=(n%10==1 && n%100!=11 ? 0 : n%10>=2 && (n%100<10 || n%100>=20) ? 1 : 2)",
            n -> {
                if (n % 10 == 1 && n % 100 != 11) return 0;
                if (n % 10 >= 2 && (n % 100 < 10 || n % 100 >= 20)) return 1;
                return 2;
            }),
    LATVIAN(3, "plural=(n%10==1 && n%100!=11 ? 0 : n != 0 ? 1 : 2)",
            n -> (n % 10 == 1 && n % 100 != 11) ? 0 : n != 0 ? 1 : 2),
    MACEDONIAN(3, "plural=n%10==1 ? 0 : n%10==2 ? 1 : 2",
            n -> n % 10 == 1 ? 0 : n % 10 == 2 ? 1 : 2),
    MANDINKA(3, "plural=(n==0 ? 0 : n==1 ? 1 : 2)",
            n -> n == 0 ? 0 : n == 1 ? 1 : 2),
    MALTESE(4, "plural=(n==1 ? 0 : n==0 || ( n%100>1 && n%100<11) ? 1 : (n%100>10 && n%100<20 ) ? 2 : 3)",
            n -> {
                if (n == 1) return 0;
                if (n == 0 || (n % 100 > 1 && n % 100 < 11)) return 1;
                if (n % 100 > 10 && n % 100 < 20) return 2;
                return 3;
            }),
    POLISH(3, "plural=(n==1 ? 0 : n%10>=2 && n%10<=4 && (n%100<10 || n%100>=20) ? 1 : 2)",
            n -> n == 1 ? 0 : PluralFamily.isFew(n) ? 1 : 2),
    ROMANIAN(3, "plural=(n==1 ? 0 : (n==0 || (n%100 > 0 && n%100 < 20)) ? 1 : 2)",
            n -> n == 1 ? 0 : (n == 0 || (n % 100 > 0 && n % 100 < 20)) ? 1 : 2),
    SLOVENIAN(4, "plural=(n%100==1 ? 1 : n%100==2 ? 2 : n%100==3 || n%100==4 ? 3 : 0)",
            n -> {
                long rem = n % 100;
                if (rem == 1) return 1;
                if (rem == 2) return 2;
                if (rem == 3 || rem == 4) return 3;
                return 0;
            });

    private final int formCount;
    private final String expression;
    private final LongToIntFunction selector;

    PluralFamily(int formCount, String expression, LongToIntFunction selector) {
        this.formCount = formCount;
        this.expression = expression;
        this.selector = selector;
    }

    public int getFormCount() {
        return formCount;
    }

    /**
     * The gettext {@code Plural-Forms} header value, e.g. {@code nplurals=2; plural=(n != 1);}.
     */
    public String pluralFormsHeader() {
        return "nplurals=" + formCount + "; " + expression + ";";
    }

    public int select(long count) {
        PluralRules.validateCount(count);
        return selector.applyAsInt(count);
    }

    // n%10 in 2..4, excluding the teens
    private static boolean isFew(long n) {
        return n % 10 >= 2 && n % 10 <= 4 && (n % 100 < 10 || n % 100 >= 20);
    }
}
