package org.lokray.sleaf.codegen;

/**
 * Decodes the escape sequences the lexer leaves in string and character literals.
 */
final class LiteralDecoder
{
	private LiteralDecoder()
	{
	}

	/**
	 * @param body The literal text without its surrounding quotes.
	 * @return The text with {@code \n \t \r \0 \\ \" \'} replaced. Unknown escapes keep the
	 * escaped character.
	 */
	static String decode(String body)
	{
		StringBuilder decoded = new StringBuilder(body.length());
		for (int i = 0; i < body.length(); i++)
		{
			char c = body.charAt(i);
			if (c != '\\' || i + 1 >= body.length())
			{
				decoded.append(c);
				continue;
			}

			char escaped = body.charAt(++i);
			switch (escaped)
			{
				case 'n':
					decoded.append('\n');
					break;
				case 't':
					decoded.append('\t');
					break;
				case 'r':
					decoded.append('\r');
					break;
				case '0':
					decoded.append('\0');
					break;
				default:
					decoded.append(escaped);
					break;
			}
		}
		return decoded.toString();
	}
}
