package dumb.tdfol.parse;

record Token(Type type, String text, int pos) {

    boolean is(Type t) {
        return type == t;
    }

    boolean isReserved(char letter) {
        return type == Type.RESERVED && text.charAt(0) == letter;
    }

    String describe() {
        return type == Type.EOF ? "end of input" : "'" + text + "'";
    }

    enum Type {
        FORALL, EXISTS, NOT, AND, OR, IMPLIES, IFF, ALWAYS, EVENTUALLY,
        LPAREN, RPAREN, COMMA, DOT, COLON,
        IDENT, RESERVED, VARIABLE, NUMBER, STRING,
        EOF
    }
}
